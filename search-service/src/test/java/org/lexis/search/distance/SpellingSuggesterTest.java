package org.lexis.search.distance;

import org.junit.jupiter.api.Test;
import org.lexis.core.model.Term;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpellingSuggesterTest {

	private final SpellingSuggester suggester = new SpellingSuggester(
			Term.listOf("car", "cart", "cat", "dog", "kitten"), EditDistance.unitCost());

	@Test
	public void testClosestFirstThenAlphabetical() {
		List<Suggestion> suggestions = suggester.suggest("cst", 1, 10);

		assertEquals(List.of(new Suggestion("cat", 1.0)), suggestions);
		assertEquals(List.of(
				new Suggestion("car", 1.0),
				new Suggestion("cat", 1.0),
				new Suggestion("cart", 2.0)), suggester.suggest("cas", 2, 10));
	}

	@Test
	public void testExactTermComesFirstAndLimitApplies() {
		List<Suggestion> suggestions = suggester.suggest("cat", 1, 2);

		assertEquals(List.of(new Suggestion("cat", 0.0), new Suggestion("car", 1.0)), suggestions);
	}

	@Test
	public void testNothingWithinRange() {
		assertEquals(List.of(), suggester.suggest("zzzzzz", 2, 10));
		assertEquals(List.of(), suggester.suggest("cat", 1, 0));
		assertThrows(IllegalArgumentException.class, () -> suggester.suggest("cat", -1, 5));
	}
}
