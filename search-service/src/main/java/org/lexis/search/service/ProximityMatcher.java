package org.lexis.search.service;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import org.lexis.core.model.PositionalPostingList;
import org.lexis.core.model.Posting;
import org.lexis.search.model.ProximityMatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Finds documents where a position of the first term lies within {@code proximity} tokens
 * (in either direction) of some position of the second term.
 */
public final class ProximityMatcher {
	private ProximityMatcher() {}

	/**
	 * Lazily merge-join both lists by document and emit the matching first-term positions.
	 * Documents without a match produce nothing.
	 */
	public static <D extends Comparable<? super D>> Iterator<ProximityMatch<D>> match(
			PositionalPostingList<D> first, PositionalPostingList<D> second, int proximity) {
		if (proximity < 0) {
			throw new IllegalArgumentException("proximity must be non-negative, got " + proximity);
		}
		return new MatchIterator<>(first.iterator(), second.iterator(), proximity);
	}

	/**
	 * Positions from {@code first} with at least one position of {@code second} no more than
	 * {@code proximity} away. Both lists must be ascending.
	 */
	public static List<Integer> matchingPositions(List<Integer> first, List<Integer> second, int proximity) {
		List<Integer> matches = new ArrayList<>();
		Deque<Integer> window = new ArrayDeque<>();
		int next = 0;

		for (int p1 : first) {
			long upper = (long) p1 + proximity;
			long lower = (long) p1 - proximity;

			while (next < second.size() && second.get(next) <= upper) {
				window.addLast(second.get(next++));
			}
			// the front is the oldest candidate; drop everything that fell behind p1
			while (!window.isEmpty() && window.peekFirst() < lower) {
				window.removeFirst();
			}
			if (!window.isEmpty()) {
				matches.add(p1);
			}
		}
		return matches;
	}

	private static final class MatchIterator<D extends Comparable<? super D>> extends AbstractIterator<ProximityMatch<D>> {
		private final PeekingIterator<Posting<D>> first;
		private final PeekingIterator<Posting<D>> second;
		private final int proximity;

		MatchIterator(Iterator<Posting<D>> first, Iterator<Posting<D>> second, int proximity) {
			this.first = Iterators.peekingIterator(first);
			this.second = Iterators.peekingIterator(second);
			this.proximity = proximity;
		}

		@Override
		protected ProximityMatch<D> computeNext() {
			while (first.hasNext() && second.hasNext()) {
				int cmp = first.peek().docId().compareTo(second.peek().docId());
				if (cmp < 0) {
					first.next();
				} else if (cmp > 0) {
					second.next();
				} else {
					Posting<D> a = first.next();
					Posting<D> b = second.next();
					List<Integer> positions = matchingPositions(a.positions(), b.positions(), proximity);
					if (!positions.isEmpty()) {
						return new ProximityMatch<>(a.docId(), positions);
					}
				}
			}
			return endOfData();
		}
	}
}
