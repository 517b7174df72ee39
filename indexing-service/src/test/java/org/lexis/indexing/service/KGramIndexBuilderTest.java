package org.lexis.indexing.service;

import org.junit.jupiter.api.Test;
import org.lexis.core.model.KGramIndex;
import org.lexis.core.model.Term;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KGramIndexBuilderTest {

	@Test
	public void testCandidatesAreSortedAndUnique() {
		KGramIndex index = new KGramIndexBuilder(2).build(Term.listOf("dog", "cart", "cat", "car"));

		assertEquals(Term.listOf("car", "cart", "cat"), index.candidates("$c"));
		assertEquals(Term.listOf("car", "cart", "cat"), index.candidates("ca"));
		assertEquals(Term.listOf("dog"), index.candidates("g$"));
		assertEquals(List.of(), index.candidates("zz"));
	}

	@Test
	public void testTermRepeatingAGramIsListedOnce() {
		KGramIndex index = new KGramIndexBuilder(2).build(Term.listOf("banana"));

		assertEquals(Term.listOf("banana"), index.candidates("an"));
		assertEquals(Term.listOf("banana"), index.candidates("na"));
	}

	@Test
	public void testRejectsBoundaryCharacterAndBadK() {
		assertThrows(IllegalArgumentException.class, () -> new KGramIndexBuilder(2).build(Term.listOf("us$")));
		assertThrows(IllegalArgumentException.class, () -> new KGramIndexBuilder(0));
	}
}
