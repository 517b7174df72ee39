package org.lexis.indexing.storage;

import java.io.IOException;
import java.util.SortedMap;

/**
 * Source of raw documents keyed by document id.
 */
public interface DocumentCollection<D extends Comparable<? super D>> {
	/**
	 * Load every document
	 * @return document id to raw content, ascending by id
	 */
	SortedMap<D, String> documents() throws IOException;
}
