package org.lexis.indexing.service;

import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.KGramIndex;
import org.lexis.core.model.PositionalIndex;
import org.lexis.core.model.Term;
import org.lexis.indexing.model.IndexSnapshot;
import org.lexis.indexing.storage.DocumentCollection;
import org.lexis.indexing.text.TermStreamProvider;
import org.lexis.indexing.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Builds a complete {@link IndexSnapshot} from a document collection. Every call allocates
 * fresh indexes; nothing is shared between snapshots.
 */
public class IndexingService {
	private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

	private final TextNormalizer normalizer;
	private final InvertedIndexBuilder invertedIndexBuilder;
	private final PositionalIndexBuilder positionalIndexBuilder;
	private final KGramIndexBuilder kgramIndexBuilder;

	public IndexingService(TextNormalizer normalizer, int kgramSize) {
		this(normalizer, new InvertedIndexBuilder(), new PositionalIndexBuilder(), new KGramIndexBuilder(kgramSize));
	}

	public IndexingService(TextNormalizer normalizer,
						   InvertedIndexBuilder invertedIndexBuilder,
						   PositionalIndexBuilder positionalIndexBuilder,
						   KGramIndexBuilder kgramIndexBuilder) {
		this.normalizer = normalizer;
		this.invertedIndexBuilder = invertedIndexBuilder;
		this.positionalIndexBuilder = positionalIndexBuilder;
		this.kgramIndexBuilder = kgramIndexBuilder;
	}

	public <D extends Comparable<? super D>> IndexSnapshot<D> buildSnapshot(DocumentCollection<D> collection)
			throws IOException {
		logger.info("Starting index build...");
		long start = System.currentTimeMillis();

		SortedMap<D, String> documents = collection.documents();

		// normalize each document once and share the streams between both builders
		Map<D, List<Term>> termStreams = new HashMap<>();
		TermStreamProvider<D> provider = TermStreamProvider.of(documents, normalizer);
		for (D docId : documents.keySet()) {
			termStreams.put(docId, provider.terms(docId));
		}

		IndexSnapshot<D> snapshot = buildSnapshot(termStreams);
		logger.info("Index build complete in {} ms: {}", System.currentTimeMillis() - start, snapshot);
		return snapshot;
	}

	/**
	 * Build from already-normalized term streams
	 */
	public <D extends Comparable<? super D>> IndexSnapshot<D> buildSnapshot(Map<D, List<Term>> termStreams) {
		InvertedIndex<D> inverted = invertedIndexBuilder.build(termStreams);
		PositionalIndex<D> positional = positionalIndexBuilder.build(termStreams);
		KGramIndex kgrams = kgramIndexBuilder.build(inverted.vocabulary());
		return new IndexSnapshot<>(inverted, positional, kgrams, termStreams.size(), Instant.now());
	}

	public TextNormalizer normalizer() {
		return normalizer;
	}
}
