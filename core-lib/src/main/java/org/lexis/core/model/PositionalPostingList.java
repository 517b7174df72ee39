package org.lexis.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Postings of one term ordered by strictly ascending document id.
 */
public record PositionalPostingList<D extends Comparable<? super D>>(List<Posting<D>> postings)
		implements Iterable<Posting<D>> {

	public PositionalPostingList {
		if (postings == null) {
			throw new IllegalArgumentException("postings must not be null");
		}
		postings = Collections.unmodifiableList(new ArrayList<>(postings));
		for (int i = 1; i < postings.size(); i++) {
			D previous = postings.get(i - 1).docId();
			D current = postings.get(i).docId();
			if (previous.compareTo(current) >= 0) {
				throw new IllegalArgumentException(
						"postings must be strictly ascending by docId, position=" + i + ", previous=" + previous
								+ ", current=" + current);
			}
		}
	}

	public static <D extends Comparable<? super D>> PositionalPostingList<D> empty() {
		return new PositionalPostingList<D>(List.<Posting<D>>of());
	}

	@SafeVarargs
	public static <D extends Comparable<? super D>> PositionalPostingList<D> of(Posting<D>... postings) {
		return new PositionalPostingList<>(List.of(postings));
	}

	public int size() {
		return postings.size();
	}

	public boolean isEmpty() {
		return postings.isEmpty();
	}

	/**
	 * Drop the positions and keep the document ids
	 */
	public PostingList<D> docIds() {
		List<D> ids = new ArrayList<>(postings.size());
		for (Posting<D> posting : postings) {
			ids.add(posting.docId());
		}
		return new PostingList<>(ids);
	}

	@NotNull
	@Override
	public Iterator<Posting<D>> iterator() {
		return postings.iterator();
	}

	@NotNull
	@Override
	public String toString() {
		return postings.toString();
	}
}
