package org.lexis.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PostingListTest {

	@Test
	public void testRejectsNonAscendingDocIds() {
		assertThrows(IllegalArgumentException.class, () -> PostingList.of(3, 1));
		assertThrows(IllegalArgumentException.class, () -> PostingList.of(2, 2));
		assertThrows(IllegalArgumentException.class, () -> new PostingList<Integer>(null));
	}

	@Test
	public void testDefensiveCopy() {
		List<Integer> ids = new ArrayList<>(List.of(1, 2));
		PostingList<Integer> postings = new PostingList<>(ids);

		ids.add(0);
		assertEquals(List.of(1, 2), postings.docIds());
		assertThrows(UnsupportedOperationException.class, () -> postings.docIds().add(9));
	}

	@Test
	public void testPositionsMustBeAscending() {
		assertThrows(IllegalArgumentException.class, () -> Posting.of(1, 4, 4));
		assertThrows(IllegalArgumentException.class, () -> Posting.of(1, -1));
		assertThrows(IllegalArgumentException.class, () -> Posting.of(1));
		assertEquals(3, Posting.of("doc", 0, 2, 9).frequency());
	}

	@Test
	public void testPositionalPostingsMustBeAscendingByDoc() {
		assertThrows(IllegalArgumentException.class,
				() -> PositionalPostingList.of(Posting.of(2, 0), Posting.of(1, 3)));

		PositionalPostingList<Integer> list = PositionalPostingList.of(Posting.of(1, 0, 4), Posting.of(7, 2));
		assertEquals(PostingList.of(1, 7), list.docIds());
	}

	@Test
	public void testAbsentTermYieldsEmptyList() {
		InvertedIndex<Integer> index = new InvertedIndex<>(Map.of(Term.of("alice"), PostingList.of(11)));

		assertTrue(index.postings("hatter").isEmpty());
		assertEquals(PostingList.of(11), index.postings("alice"));
		assertEquals(1, index.totalPostings());
	}

	@Test
	public void testEmptyListsAreTyped() {
		PostingList<String> postings = PostingList.empty();
		PositionalPostingList<Integer> positional = PositionalPostingList.empty();

		assertTrue(postings.isEmpty());
		assertEquals(List.of(), postings.docIds());
		assertEquals(0, positional.size());
		assertTrue(positional.docIds().isEmpty());
	}

	@Test
	public void testTermOrdering() {
		assertTrue(Term.of("car").compareTo(Term.of("cart")) < 0);
		assertTrue(Term.of("dog").compareTo(Term.of("cat")) > 0);
		assertEquals(Term.of("cat"), new Term("cat"));
		assertThrows(IllegalArgumentException.class, () -> Term.of(null));
	}
}
