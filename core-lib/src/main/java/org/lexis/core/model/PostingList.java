package org.lexis.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Strictly ascending, duplicate-free list of document ids for one term.
 *
 * @param docIds ascending document ids
 * @param <D> document id type
 */
public record PostingList<D extends Comparable<? super D>>(List<D> docIds) implements Iterable<D> {

	public PostingList {
		if (docIds == null) {
			throw new IllegalArgumentException("docIds must not be null");
		}
		docIds = Collections.unmodifiableList(new ArrayList<>(docIds));
		for (int i = 0; i < docIds.size(); i++) {
			D current = docIds.get(i);
			if (current == null) {
				throw new IllegalArgumentException("docId must not be null, position=" + i);
			}
			if (i > 0 && docIds.get(i - 1).compareTo(current) >= 0) {
				throw new IllegalArgumentException(
						"docIds must be strictly ascending, position=" + i + ", previous=" + docIds.get(i - 1)
								+ ", current=" + current);
			}
		}
	}

	public static <D extends Comparable<? super D>> PostingList<D> empty() {
		return new PostingList<D>(List.<D>of());
	}

	@SafeVarargs
	public static <D extends Comparable<? super D>> PostingList<D> of(D... docIds) {
		return new PostingList<>(List.of(docIds));
	}

	/**
	 * Collect an already ascending, duplicate-free iterator
	 */
	public static <D extends Comparable<? super D>> PostingList<D> copyOf(Iterator<? extends D> docIds) {
		List<D> collected = new ArrayList<>();
		docIds.forEachRemaining(collected::add);
		return new PostingList<>(collected);
	}

	public int size() {
		return docIds.size();
	}

	public boolean isEmpty() {
		return docIds.isEmpty();
	}

	public D get(int index) {
		return docIds.get(index);
	}

	public Stream<D> stream() {
		return docIds.stream();
	}

	@NotNull
	@Override
	public Iterator<D> iterator() {
		return docIds.iterator();
	}

	@NotNull
	@Override
	public String toString() {
		return docIds.toString();
	}
}
