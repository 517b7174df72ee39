package org.lexis.search.distance;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class EditDistanceTest {

	private final EditDistance<Character> unit = EditDistance.unitCost();

	@Test
	public void testKittenToSitting() {
		assertEquals(3, EditDistance.levenshtein("kitten", "sitting"));

		List<EditOperation<Character>> alignment = EditDistance.alignStrings("kitten", "sitting");
		assertEquals(3.0, totalCost(alignment), 1e-9);
		assertEquals(3, alignment.stream().filter(op -> op.kind() != EditOperation.Kind.MATCH).count());
		assertEquals("kitten", sourceOf(alignment));
		assertEquals("sitting", destOf(alignment));
	}

	@Test
	public void testTableShapeAndBaseCases() {
		EditDistanceTable<Character> table = unit.table(EditDistance.chars("kitten"), EditDistance.chars("sitting"));

		assertEquals(8, table.rows());
		assertEquals(7, table.columns());
		assertEquals(0.0, table.cost(0, 0));
		for (int j = 0; j < table.columns(); j++) {
			assertEquals(j, table.cost(0, j), 1e-9);
		}
		for (int i = 0; i < table.rows(); i++) {
			assertEquals(i, table.cost(i, 0), 1e-9);
		}
		assertEquals(3.0, table.distance(), 1e-9);
	}

	@Test
	public void testEmptySequencesReduceToInsertionsOrDeletions() {
		assertEquals(3, EditDistance.levenshtein("", "abc"));
		assertEquals(2, EditDistance.levenshtein("ab", ""));
		assertEquals(0, EditDistance.levenshtein("", ""));

		List<EditOperation<Character>> inserts = EditDistance.alignStrings("", "ab");
		assertEquals(List.of(EditOperation.insert('a', 1.0), EditOperation.insert('b', 1.0)), inserts);

		List<EditOperation<Character>> deletes = EditDistance.alignStrings("ab", "");
		assertEquals(List.of(EditOperation.delete('a', 1.0), EditOperation.delete('b', 1.0)), deletes);

		assertEquals(List.of(), EditDistance.alignStrings("", ""));
	}

	@Test
	public void testTiesPreferSubstitution() {
		// delete a, keep b, insert a is equally cheap; the backtrace picks two substitutions
		List<EditOperation<Character>> alignment = EditDistance.alignStrings("ab", "ba");

		assertEquals(List.of(
				EditOperation.substitute('a', 'b', 1.0),
				EditOperation.substitute('b', 'a', 1.0)), alignment);
	}

	@Test
	public void testExpensiveSubstitutionAlignsWithInsertAndDelete() {
		EditDistance<Character> weighted = new EditDistance<>(
				EditCosts.<Character>unit().withSubstitute((a, b) -> a.equals(b) ? 0.0 : 2.0));

		List<EditOperation<Character>> alignment = weighted.align(EditDistance.chars("ab"), EditDistance.chars("ba"));

		assertEquals(2.0, weighted.distance(EditDistance.chars("ab"), EditDistance.chars("ba")), 1e-9);
		assertEquals(List.of(
				EditOperation.insert('b', 1.0),
				EditOperation.substitute('a', 'a', 0.0),
				EditOperation.delete('b', 1.0)), alignment);
	}

	@Test
	public void testFractionalCosts() {
		EditDistance<Character> cheapInserts = new EditDistance<>(EditCosts.<Character>unit().withInsert(c -> 0.5));

		assertEquals(1.0, cheapInserts.distance(EditDistance.chars(""), EditDistance.chars("ab")), 1e-9);
		assertEquals(2.0, cheapInserts.distance(EditDistance.chars("a"), EditDistance.chars("bcd")), 1e-9);
	}

	@Test
	public void testAlignmentCostAlwaysEqualsDistance() {
		Random random = new Random(11);
		EditDistance<Character> weighted = new EditDistance<>(new EditCosts<Character>(
				c -> c == 'a' ? 0.5 : 1.0,
				c -> 1.5,
				(a, b) -> a.equals(b) ? 0.0 : 1.25));

		for (int trial = 0; trial < 200; trial++) {
			List<Character> source = EditDistance.chars(randomWord(random));
			List<Character> dest = EditDistance.chars(randomWord(random));

			for (EditDistance<Character> engine : List.of(unit, weighted)) {
				double distance = engine.distance(source, dest);
				List<EditOperation<Character>> alignment = engine.align(source, dest);
				assertEquals(distance, totalCost(alignment), 1e-9, source + " -> " + dest);
				assertEquals(join(source), sourceOf(alignment));
				assertEquals(join(dest), destOf(alignment));
			}
		}
	}

	@Test
	public void testWorksOnArbitraryElementTypes() {
		EditDistance<String> words = EditDistance.unitCost();

		assertEquals(1.0, words.distance(List.of("the", "quick", "fox"), List.of("the", "slow", "fox")), 1e-9);
	}

	@Test
	public void testNegativeCostIsRejected() {
		EditDistance<Character> broken = new EditDistance<>(EditCosts.<Character>unit().withDelete(c -> -1.0));

		assertThrows(IllegalArgumentException.class,
				() -> broken.distance(EditDistance.chars("a"), EditDistance.chars("")));
	}

	private static double totalCost(List<EditOperation<Character>> alignment) {
		return alignment.stream().mapToDouble(EditOperation::cost).sum();
	}

	private static String sourceOf(List<EditOperation<Character>> alignment) {
		StringBuilder sb = new StringBuilder();
		alignment.stream().filter(op -> op.source() != null).forEach(op -> sb.append(op.source()));
		return sb.toString();
	}

	private static String destOf(List<EditOperation<Character>> alignment) {
		StringBuilder sb = new StringBuilder();
		alignment.stream().filter(op -> op.dest() != null).forEach(op -> sb.append(op.dest()));
		return sb.toString();
	}

	private static String join(List<Character> chars) {
		StringBuilder sb = new StringBuilder();
		chars.forEach(sb::append);
		return sb.toString();
	}

	private static String randomWord(Random random) {
		StringBuilder sb = new StringBuilder();
		int length = random.nextInt(7);
		for (int i = 0; i < length; i++) {
			sb.append((char) ('a' + random.nextInt(3)));
		}
		return sb.toString();
	}
}
