package org.lexis.indexing.storage;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

public class InMemoryDocumentCollection<D extends Comparable<? super D>> implements DocumentCollection<D> {
	private final SortedMap<D, String> documents;

	public InMemoryDocumentCollection(Map<D, String> documents) {
		this.documents = Collections.unmodifiableSortedMap(new TreeMap<>(documents));
	}

	@Override
	public SortedMap<D, String> documents() {
		return documents;
	}
}
