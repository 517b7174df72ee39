package org.lexis.indexing.model;

import org.jetbrains.annotations.NotNull;
import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.KGramIndex;
import org.lexis.core.model.PositionalIndex;

import java.time.Instant;

/**
 * One immutable generation of every index built from the same document collection.
 */
public record IndexSnapshot<D extends Comparable<? super D>>(
		InvertedIndex<D> invertedIndex,
		PositionalIndex<D> positionalIndex,
		KGramIndex kgramIndex,
		int documentCount,
		Instant builtAt
) {
	public IndexStats stats() {
		return new IndexStats(
				documentCount,
				invertedIndex.termCount(),
				invertedIndex.totalPostings(),
				kgramIndex.k(),
				kgramIndex.gramCount(),
				builtAt.toString()
		);
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("IndexSnapshot{documents=%d, terms=%d, grams=%d, builtAt=%s}",
				documentCount, invertedIndex.termCount(), kgramIndex.gramCount(), builtAt);
	}
}
