package org.lexis.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable mapping from term to posting list. Lookups of unknown terms return
 * an empty posting list.
 */
public final class InvertedIndex<D extends Comparable<? super D>> {
	private final TreeMap<Term, PostingList<D>> postings;

	public InvertedIndex(Map<Term, PostingList<D>> postings) {
		this.postings = new TreeMap<>(postings);
	}

	public PostingList<D> postings(Term term) {
		PostingList<D> list = postings.get(term);
		return list != null ? list : PostingList.empty();
	}

	public PostingList<D> postings(String term) {
		return postings(Term.of(term));
	}

	public boolean contains(Term term) {
		return postings.containsKey(term);
	}

	/**
	 * Terms of the index in ascending order
	 */
	public NavigableSet<Term> vocabulary() {
		return Collections.unmodifiableNavigableSet(postings.navigableKeySet());
	}

	public Map<Term, PostingList<D>> asMap() {
		return Collections.unmodifiableMap(postings);
	}

	public int termCount() {
		return postings.size();
	}

	/**
	 * Sum of all posting list lengths
	 */
	public long totalPostings() {
		long total = 0;
		for (PostingList<D> list : postings.values()) {
			total += list.size();
		}
		return total;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof InvertedIndex<?> other)) return false;
		return postings.equals(other.postings);
	}

	@Override
	public int hashCode() {
		return Objects.hash(postings);
	}

	@Override
	public String toString() {
		return "InvertedIndex{terms=" + postings.size() + "}";
	}
}
