package org.lexis.indexing.service;

import org.lexis.core.model.PositionalIndex;
import org.lexis.core.model.PositionalPostingList;
import org.lexis.core.model.Posting;
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
 * Builds per-document position lists; positions are 0-based offsets into the term stream.
 */
public class PositionalIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(PositionalIndexBuilder.class);

	public <D extends Comparable<? super D>> PositionalIndex<D> build(Map<D, ? extends Iterable<Term>> termStreams) {
		return build(termStreams.keySet(), docId -> InvertedIndexBuilder.toList(termStreams.get(docId)));
	}

	public <D extends Comparable<? super D>> PositionalIndex<D> build(Collection<D> docIds, TermStreamProvider<D> provider) {
		Map<Term, List<Occurrences<D>>> postings = new HashMap<>();

		for (D docId : new TreeSet<>(docIds)) {
			int position = 0;
			for (Term term : provider.terms(docId)) {
				List<Occurrences<D>> list = postings.computeIfAbsent(term, k -> new ArrayList<>());
				Occurrences<D> last = list.isEmpty() ? null : list.get(list.size() - 1);
				if (last == null || !last.docId.equals(docId)) {
					last = new Occurrences<>(docId);
					list.add(last);
				}
				last.positions.add(position);
				position++;
			}
		}

		Map<Term, PositionalPostingList<D>> frozen = new TreeMap<>();
		postings.forEach((term, list) -> {
			List<Posting<D>> converted = new ArrayList<>(list.size());
			for (Occurrences<D> occurrences : list) {
				converted.add(new Posting<>(occurrences.docId, occurrences.positions));
			}
			frozen.put(term, new PositionalPostingList<>(converted));
		});

		logger.info("Built positional index: {} documents, {} unique terms", docIds.size(), frozen.size());
		return new PositionalIndex<>(frozen);
	}

	private static final class Occurrences<D> {
		private final D docId;
		private final List<Integer> positions = new ArrayList<>();

		Occurrences(D docId) {
			this.docId = docId;
		}
	}
}
