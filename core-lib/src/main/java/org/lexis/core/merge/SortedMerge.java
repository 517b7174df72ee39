package org.lexis.core.merge;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Linear merge-join over ascending, duplicate-free sequences.
 *
 * <p>Nothing here sorts: every operand must already be strictly ascending. Results are
 * produced lazily and can be consumed once; call again to restart.</p>
 */
public final class SortedMerge {
	private SortedMerge() {}

	public static <T extends Comparable<? super T>> Iterator<T> intersect(Iterator<? extends T> first,
																		  Iterator<? extends T> second) {
		return new IntersectionIterator<>(first, second);
	}

	public static <T extends Comparable<? super T>> Iterator<T> union(Iterator<? extends T> first,
																	  Iterator<? extends T> second) {
		return new UnionIterator<>(first, second);
	}

	/**
	 * Intersection of two iterables; every {@code iterator()} call restarts the merge
	 */
	public static <T extends Comparable<? super T>> Iterable<T> intersect(Iterable<? extends T> first,
																		  Iterable<? extends T> second) {
		return () -> intersect(first.iterator(), second.iterator());
	}

	public static <T extends Comparable<? super T>> Iterable<T> union(Iterable<? extends T> first,
																	  Iterable<? extends T> second) {
		return () -> union(first.iterator(), second.iterator());
	}

	/**
	 * N-way intersection by pairwise reduction. No operands yields an empty result.
	 */
	public static <T extends Comparable<? super T>> Iterator<T> intersectAll(
			Collection<? extends Iterable<? extends T>> operands) {
		return reduce(SortedMerge.<T>iteratorsOf(operands), true);
	}

	/**
	 * N-way union by pairwise reduction. No operands yields an empty result.
	 */
	public static <T extends Comparable<? super T>> Iterator<T> unionAll(
			Collection<? extends Iterable<? extends T>> operands) {
		return reduce(SortedMerge.<T>iteratorsOf(operands), false);
	}

	/**
	 * Lazy sequential stream over a merge result, so callers can short-circuit with {@code limit}
	 */
	public static <T> Stream<T> stream(Iterator<T> iterator) {
		return StreamSupport.stream(
				Spliterators.spliteratorUnknownSize(iterator,
						Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
				false);
	}

	private static <T> List<Iterator<T>> iteratorsOf(Collection<? extends Iterable<? extends T>> operands) {
		List<Iterator<T>> iterators = new ArrayList<>(operands.size());
		for (Iterable<? extends T> operand : operands) {
			iterators.add(Iterators.unmodifiableIterator(operand.iterator()));
		}
		return iterators;
	}

	// merges neighbours round by round, so the iterator tree is log2(n) deep
	private static <T extends Comparable<? super T>> Iterator<T> reduce(List<Iterator<T>> level, boolean intersect) {
		if (level.isEmpty()) {
			return Collections.emptyIterator();
		}
		while (level.size() > 1) {
			List<Iterator<T>> next = new ArrayList<>((level.size() + 1) / 2);
			for (int i = 0; i + 1 < level.size(); i += 2) {
				next.add(intersect ? intersect(level.get(i), level.get(i + 1)) : union(level.get(i), level.get(i + 1)));
			}
			if (level.size() % 2 == 1) {
				next.add(level.get(level.size() - 1));
			}
			level = next;
		}
		return level.get(0);
	}

	private static final class IntersectionIterator<T extends Comparable<? super T>> extends AbstractIterator<T> {
		private final PeekingIterator<? extends T> first;
		private final PeekingIterator<? extends T> second;

		IntersectionIterator(Iterator<? extends T> first, Iterator<? extends T> second) {
			this.first = Iterators.peekingIterator(first);
			this.second = Iterators.peekingIterator(second);
		}

		@Override
		protected T computeNext() {
			while (first.hasNext() && second.hasNext()) {
				int cmp = first.peek().compareTo(second.peek());
				if (cmp == 0) {
					second.next();
					return first.next();
				} else if (cmp < 0) {
					first.next();
				} else {
					second.next();
				}
			}
			return endOfData();
		}
	}

	private static final class UnionIterator<T extends Comparable<? super T>> extends AbstractIterator<T> {
		private final PeekingIterator<? extends T> first;
		private final PeekingIterator<? extends T> second;

		UnionIterator(Iterator<? extends T> first, Iterator<? extends T> second) {
			this.first = Iterators.peekingIterator(first);
			this.second = Iterators.peekingIterator(second);
		}

		@Override
		protected T computeNext() {
			if (first.hasNext() && second.hasNext()) {
				int cmp = first.peek().compareTo(second.peek());
				if (cmp == 0) {
					second.next();
					return first.next();
				}
				return cmp < 0 ? first.next() : second.next();
			}
			// one side is exhausted, drain the other
			if (first.hasNext()) {
				return first.next();
			}
			if (second.hasNext()) {
				return second.next();
			}
			return endOfData();
		}
	}
}
