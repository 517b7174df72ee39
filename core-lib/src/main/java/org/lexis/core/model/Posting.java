package org.lexis.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Occurrences of one term in one document.
 *
 * @param docId document the term occurs in
 * @param positions strictly ascending 0-based token offsets
 */
public record Posting<D extends Comparable<? super D>>(D docId, List<Integer> positions) {

	public Posting {
		if (docId == null) {
			throw new IllegalArgumentException("docId must not be null");
		}
		if (positions == null || positions.isEmpty()) {
			throw new IllegalArgumentException("positions must not be empty for document " + docId);
		}
		positions = Collections.unmodifiableList(new ArrayList<>(positions));
		int previous = -1;
		for (Integer position : positions) {
			if (position == null || position <= previous) {
				throw new IllegalArgumentException(
						"positions must be non-negative and strictly ascending for document " + docId + ": " + positions);
			}
			previous = position;
		}
	}

	public static <D extends Comparable<? super D>> Posting<D> of(D docId, Integer... positions) {
		return new Posting<>(docId, List.of(positions));
	}

	public int frequency() {
		return positions.size();
	}

	@NotNull
	@Override
	public String toString() {
		return docId + ":" + positions;
	}
}
