package org.lexis.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable mapping from term to positional postings.
 */
public final class PositionalIndex<D extends Comparable<? super D>> {
	private final TreeMap<Term, PositionalPostingList<D>> postings;

	public PositionalIndex(Map<Term, PositionalPostingList<D>> postings) {
		this.postings = new TreeMap<>(postings);
	}

	public PositionalPostingList<D> postings(Term term) {
		PositionalPostingList<D> list = postings.get(term);
		return list != null ? list : PositionalPostingList.empty();
	}

	public PositionalPostingList<D> postings(String term) {
		return postings(Term.of(term));
	}

	public NavigableSet<Term> vocabulary() {
		return Collections.unmodifiableNavigableSet(postings.navigableKeySet());
	}

	public Map<Term, PositionalPostingList<D>> asMap() {
		return Collections.unmodifiableMap(postings);
	}

	public int termCount() {
		return postings.size();
	}

	/**
	 * Collapse to a document-level index
	 */
	public InvertedIndex<D> toInvertedIndex() {
		TreeMap<Term, PostingList<D>> docLevel = new TreeMap<>();
		postings.forEach((term, list) -> docLevel.put(term, list.docIds()));
		return new InvertedIndex<>(docLevel);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PositionalIndex<?> other)) return false;
		return postings.equals(other.postings);
	}

	@Override
	public int hashCode() {
		return Objects.hash(postings);
	}

	@Override
	public String toString() {
		return "PositionalIndex{terms=" + postings.size() + "}";
	}
}
