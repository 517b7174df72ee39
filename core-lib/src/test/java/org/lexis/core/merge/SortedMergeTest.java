package org.lexis.core.merge;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.lexis.core.model.PostingList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SortedMergeTest {

	@Test
	public void testExhaustiveSmallListsMatchSetSemantics() {
		List<List<Integer>> subsets = subsetsOf(List.of(1, 2, 3, 4, 5, 6), 4);
		for (List<Integer> a : subsets) {
			for (List<Integer> b : subsets) {
				TreeSet<Integer> expectedAnd = new TreeSet<>(a);
				expectedAnd.retainAll(b);
				TreeSet<Integer> expectedOr = new TreeSet<>(a);
				expectedOr.addAll(b);

				assertEquals(new ArrayList<>(expectedAnd), drain(SortedMerge.intersect(a.iterator(), b.iterator())),
						"intersect " + a + " " + b);
				assertEquals(new ArrayList<>(expectedOr), drain(SortedMerge.union(a.iterator(), b.iterator())),
						"union " + a + " " + b);
			}
		}
		System.out.println("Exhaustive merge test passed! (" + subsets.size() + " operands)");
	}

	@Test
	public void testRandomListsMatchSetSemantics() {
		Random random = new Random(7);
		for (int trial = 0; trial < 500; trial++) {
			List<Integer> a = randomAscending(random);
			List<Integer> b = randomAscending(random);

			TreeSet<Integer> expectedAnd = new TreeSet<>(a);
			expectedAnd.retainAll(b);
			TreeSet<Integer> expectedOr = new TreeSet<>(a);
			expectedOr.addAll(b);

			assertEquals(new ArrayList<>(expectedAnd), drain(SortedMerge.intersect(a.iterator(), b.iterator())));
			assertEquals(new ArrayList<>(expectedOr), drain(SortedMerge.union(a.iterator(), b.iterator())));
		}
	}

	@Test
	public void testEmptyOperands() {
		List<Integer> empty = List.of();
		List<Integer> values = List.of(2, 4, 9);

		assertEquals(List.of(), drain(SortedMerge.intersect(empty.iterator(), values.iterator())));
		assertEquals(List.of(), drain(SortedMerge.intersect(values.iterator(), empty.iterator())));
		assertEquals(values, drain(SortedMerge.union(empty.iterator(), values.iterator())));
		assertEquals(values, drain(SortedMerge.union(values.iterator(), empty.iterator())));
		assertEquals(List.of(), drain(SortedMerge.union(empty.iterator(), empty.iterator())));
	}

	@Test
	public void testListCombinedWithItselfIsUnchanged() {
		PostingList<Integer> postings = PostingList.of(1, 5, 8, 13);

		assertEquals(postings.docIds(), drain(SortedMerge.intersect(postings, postings).iterator()));
		assertEquals(postings.docIds(), drain(SortedMerge.union(postings, postings).iterator()));
	}

	@Test
	public void testStringKeysMergeLexicographically() {
		List<String> a = List.of("a.txt", "c.txt", "d.txt");
		List<String> b = List.of("b.txt", "c.txt");

		assertEquals(List.of("c.txt"), drain(SortedMerge.intersect(a.iterator(), b.iterator())));
		assertEquals(List.of("a.txt", "b.txt", "c.txt", "d.txt"), drain(SortedMerge.union(a.iterator(), b.iterator())));
	}

	@Test
	public void testNWayReduction() {
		List<PostingList<Integer>> lists = List.of(
				PostingList.of(1, 2, 3, 5, 8),
				PostingList.of(2, 3, 5, 7),
				PostingList.of(0, 3, 5, 9));

		assertEquals(List.of(3, 5), drain(SortedMerge.intersectAll(lists)));
		assertEquals(List.of(0, 1, 2, 3, 5, 7, 8, 9), drain(SortedMerge.unionAll(lists)));
	}

	@Test
	public void testNWayWithNoOperandsIsEmpty() {
		assertFalse(SortedMerge.<Integer>intersectAll(Collections.emptyList()).hasNext());
		assertFalse(SortedMerge.<Integer>unionAll(Collections.emptyList()).hasNext());
	}

	@Test
	public void testNWayWithSingleOperandReturnsIt() {
		List<PostingList<Integer>> lists = List.of(PostingList.of(4, 6));
		assertEquals(List.of(4, 6), drain(SortedMerge.intersectAll(lists)));
		assertEquals(List.of(4, 6), drain(SortedMerge.unionAll(lists)));
	}

	@Test
	public void testNWayOverManyOperandsStaysShallow() {
		int operands = 50_000;
		List<PostingList<Integer>> singletons = new ArrayList<>(operands);
		List<PostingList<Integer>> identical = new ArrayList<>(operands);
		PostingList<Integer> shared = PostingList.of(3, 9);
		for (int i = 0; i < operands; i++) {
			singletons.add(PostingList.of(operands - 1 - i));
			identical.add(shared);
		}

		List<Integer> union = drain(SortedMerge.unionAll(singletons));
		assertEquals(operands, union.size());
		for (int i = 0; i < operands; i++) {
			assertEquals(Integer.valueOf(i), union.get(i));
		}
		assertEquals(List.of(3, 9), drain(SortedMerge.intersectAll(identical)));
		assertEquals(List.of(), drain(SortedMerge.intersectAll(singletons)));
	}

	@Test
	public void testNWayOddOperandCountKeepsTheLastList() {
		List<PostingList<Integer>> lists = List.of(
				PostingList.of(1, 4),
				PostingList.of(2, 4),
				PostingList.of(3, 4, 6),
				PostingList.of(4, 5),
				PostingList.of(4, 7));

		assertEquals(List.of(4), drain(SortedMerge.intersectAll(lists)));
		assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), drain(SortedMerge.unionAll(lists)));
	}

	@Test
	public void testResultsAreProducedLazily() {
		CountingIterator first = new CountingIterator(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));
		CountingIterator second = new CountingIterator(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

		List<Integer> firstTwo = SortedMerge.stream(SortedMerge.intersect(first, second))
				.limit(2)
				.collect(Collectors.toList());

		assertEquals(List.of(1, 2), firstTwo);
		assertTrue(first.consumed < 10, "intersection consumed the whole input: " + first.consumed);
	}

	@Test
	public void testExhaustedIteratorStaysExhaustedButIterableRestarts() {
		Iterable<Integer> union = SortedMerge.union(List.of(1, 3), List.of(2));

		Iterator<Integer> once = union.iterator();
		assertEquals(List.of(1, 2, 3), drain(once));
		assertFalse(once.hasNext());
		assertThrows(NoSuchElementException.class, once::next);

		assertEquals(List.of(1, 2, 3), drain(union.iterator()));
	}

	private static <T> List<T> drain(Iterator<T> iterator) {
		List<T> result = new ArrayList<>();
		iterator.forEachRemaining(result::add);
		return result;
	}

	private static List<Integer> randomAscending(Random random) {
		TreeSet<Integer> values = new TreeSet<>();
		int size = random.nextInt(20);
		for (int i = 0; i < size; i++) {
			values.add(random.nextInt(40));
		}
		return new ArrayList<>(values);
	}

	private static List<List<Integer>> subsetsOf(List<Integer> universe, int maxSize) {
		List<List<Integer>> result = new ArrayList<>();
		for (int mask = 0; mask < (1 << universe.size()); mask++) {
			if (Integer.bitCount(mask) > maxSize) {
				continue;
			}
			ImmutableList.Builder<Integer> subset = ImmutableList.builder();
			for (int i = 0; i < universe.size(); i++) {
				if ((mask & (1 << i)) != 0) {
					subset.add(universe.get(i));
				}
			}
			result.add(subset.build());
		}
		return result;
	}

	private static final class CountingIterator implements Iterator<Integer> {
		private final Iterator<Integer> delegate;
		private int consumed;

		CountingIterator(List<Integer> values) {
			this.delegate = values.iterator();
		}

		@Override
		public boolean hasNext() {
			return delegate.hasNext();
		}

		@Override
		public Integer next() {
			consumed++;
			return delegate.next();
		}
	}
}
