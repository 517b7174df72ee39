package org.lexis.search.service;

import org.lexis.core.merge.SortedMerge;
import org.lexis.core.model.PostingList;
import org.lexis.core.model.Term;
import org.lexis.indexing.model.IndexSnapshot;
import org.lexis.search.model.ProximityMatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Read-only query operations over one index snapshot. Every result is a lazy ascending,
 * duplicate-free iterator; unknown terms behave as empty posting lists.
 */
public class QueryService<D extends Comparable<? super D>> {
	private final IndexSnapshot<D> snapshot;
	private final WildcardMatcher<D> wildcardMatcher;

	public QueryService(IndexSnapshot<D> snapshot) {
		this.snapshot = snapshot;
		this.wildcardMatcher = new WildcardMatcher<>(snapshot.invertedIndex(), snapshot.kgramIndex());
	}

	public Iterator<D> and(Term first, Term second) {
		return SortedMerge.intersect(postings(first).iterator(), postings(second).iterator());
	}

	public Iterator<D> or(Term first, Term second) {
		return SortedMerge.union(postings(first).iterator(), postings(second).iterator());
	}

	public Iterator<D> andAll(Collection<Term> terms) {
		return SortedMerge.intersectAll(postingsOf(terms));
	}

	public Iterator<D> orAll(Collection<Term> terms) {
		return SortedMerge.unionAll(postingsOf(terms));
	}

	public Iterator<ProximityMatch<D>> near(Term first, Term second, int proximity) {
		return ProximityMatcher.match(
				snapshot.positionalIndex().postings(first),
				snapshot.positionalIndex().postings(second),
				proximity);
	}

	public Iterator<D> wildcard(String pattern) {
		return wildcardMatcher.query(pattern);
	}

	public List<Term> wildcardTerms(String pattern) {
		return wildcardMatcher.matchingTerms(pattern);
	}

	public PostingList<D> postings(Term term) {
		return snapshot.invertedIndex().postings(term);
	}

	public IndexSnapshot<D> snapshot() {
		return snapshot;
	}

	private List<PostingList<D>> postingsOf(Collection<Term> terms) {
		List<PostingList<D>> lists = new ArrayList<>(terms.size());
		for (Term term : terms) {
			lists.add(postings(term));
		}
		return lists;
	}
}
