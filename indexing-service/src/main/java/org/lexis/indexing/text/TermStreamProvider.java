package org.lexis.indexing.text;

import org.lexis.core.model.Term;

import java.util.List;
import java.util.Map;

/**
 * Supplies the normalized term stream of a document. Two calls for the same document
 * must return equal lists.
 */
@FunctionalInterface
public interface TermStreamProvider<D> {
	/**
	 * @return the document's terms in token order, empty if the document has none
	 */
	List<Term> terms(D docId);

	/**
	 * Normalize raw document contents on demand
	 */
	static <D> TermStreamProvider<D> of(Map<D, String> contents, TextNormalizer normalizer) {
		return docId -> {
			String content = contents.get(docId);
			return content == null ? List.of() : normalizer.normalize(content);
		};
	}
}
