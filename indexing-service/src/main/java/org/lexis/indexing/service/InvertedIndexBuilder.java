package org.lexis.indexing.service;

import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.PostingList;
import org.lexis.core.model.Term;
import org.lexis.indexing.text.TermStreamProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds document-level posting lists in one pass over the documents in ascending id order.
 */
public class InvertedIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

	/**
	 * Index pre-normalized term streams
	 */
	public <D extends Comparable<? super D>> InvertedIndex<D> build(Map<D, ? extends Iterable<Term>> termStreams) {
		return build(termStreams.keySet(), docId -> toList(termStreams.get(docId)));
	}

	public <D extends Comparable<? super D>> InvertedIndex<D> build(Collection<D> docIds, TermStreamProvider<D> provider) {
		Map<Term, List<D>> postings = new HashMap<>();
		long tokens = 0;

		for (D docId : new TreeSet<>(docIds)) {
			for (Term term : provider.terms(docId)) {
				List<D> list = postings.computeIfAbsent(term, k -> new ArrayList<>());
				if (list.isEmpty() || !list.get(list.size() - 1).equals(docId)) {
					list.add(docId);
				}
				tokens++;
			}
			logger.debug("Indexed document {}", docId);
		}

		Map<Term, PostingList<D>> frozen = new TreeMap<>();
		postings.forEach((term, list) -> frozen.put(term, new PostingList<>(list)));

		logger.info("Built inverted index: {} documents, {} tokens, {} unique terms",
				docIds.size(), tokens, frozen.size());
		return new InvertedIndex<>(frozen);
	}

	static List<Term> toList(Iterable<Term> terms) {
		if (terms == null) {
			return List.of();
		}
		if (terms instanceof List<Term> list) {
			return list;
		}
		List<Term> copy = new ArrayList<>();
		terms.forEach(copy::add);
		return copy;
	}
}
