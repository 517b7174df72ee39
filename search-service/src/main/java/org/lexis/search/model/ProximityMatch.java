package org.lexis.search.model;

import java.util.List;

/**
 * A document where the first term occurs near the second.
 *
 * @param docId matching document
 * @param positions ascending positions of the first term that have a second-term occurrence within range
 */
public record ProximityMatch<D>(D docId, List<Integer> positions) {
	public ProximityMatch {
		positions = List.copyOf(positions);
	}
}
