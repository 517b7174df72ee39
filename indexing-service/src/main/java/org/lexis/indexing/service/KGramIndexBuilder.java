package org.lexis.indexing.service;

import org.lexis.core.model.KGramIndex;
import org.lexis.core.model.KGrams;
import org.lexis.core.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a k-gram index over a vocabulary with sorted insertion into each gram's term list.
 */
public class KGramIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(KGramIndexBuilder.class);

	private final int k;

	public KGramIndexBuilder(int k) {
		if (k < 1) {
			throw new IllegalArgumentException("k must be at least 1, got " + k);
		}
		this.k = k;
	}

	public KGramIndex build(Iterable<Term> vocabulary) {
		Map<String, List<Term>> candidates = new HashMap<>();
		int terms = 0;

		for (Term term : vocabulary) {
			if (term.text().indexOf(KGrams.BOUNDARY) >= 0) {
				throw new IllegalArgumentException(
						"Term '" + term + "' contains the k-gram boundary character '" + KGrams.BOUNDARY + "'");
			}
			for (String gram : KGrams.of(term, k)) {
				insertSorted(candidates.computeIfAbsent(gram, g -> new ArrayList<>()), term);
			}
			terms++;
		}

		logger.info("Built {}-gram index: {} terms, {} grams", k, terms, candidates.size());
		return new KGramIndex(k, candidates);
	}

	public int k() {
		return k;
	}

	private static void insertSorted(List<Term> list, Term term) {
		int at = Collections.binarySearch(list, term);
		if (at < 0) {
			list.add(-at - 1, term);
		}
	}
}
