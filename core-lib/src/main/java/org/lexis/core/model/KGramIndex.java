package org.lexis.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable mapping from k-gram to the sorted, duplicate-free terms containing it.
 */
public final class KGramIndex {
	private final int k;
	private final TreeMap<String, List<Term>> candidates;

	public KGramIndex(int k, Map<String, List<Term>> candidates) {
		if (k < 1) {
			throw new IllegalArgumentException("k must be at least 1, got " + k);
		}
		this.k = k;
		this.candidates = new TreeMap<>();
		candidates.forEach((gram, terms) -> this.candidates.put(gram, List.copyOf(terms)));
	}

	public int k() {
		return k;
	}

	/**
	 * Terms containing {@code gram}, ascending; empty for an unknown gram
	 */
	public List<Term> candidates(String gram) {
		return candidates.getOrDefault(gram, List.of());
	}

	public Map<String, List<Term>> asMap() {
		return Collections.unmodifiableMap(candidates);
	}

	public int gramCount() {
		return candidates.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof KGramIndex other)) return false;
		return k == other.k && candidates.equals(other.candidates);
	}

	@Override
	public int hashCode() {
		return Objects.hash(k, candidates);
	}

	@Override
	public String toString() {
		return "KGramIndex{k=" + k + ", grams=" + candidates.size() + "}";
	}
}
