package org.lexis.search.service;

import org.lexis.core.merge.SortedMerge;
import org.lexis.core.model.Term;
import org.lexis.indexing.model.IndexSnapshot;
import org.lexis.indexing.model.IndexStats;
import org.lexis.indexing.service.IndexingService;
import org.lexis.indexing.storage.DocumentCollection;
import org.lexis.indexing.text.TextNormalizer;
import org.lexis.search.distance.EditDistance;
import org.lexis.search.distance.SpellingSuggester;
import org.lexis.search.distance.Suggestion;
import org.lexis.search.model.BooleanOperator;
import org.lexis.search.model.DistanceResponse;
import org.lexis.search.model.ProximityMatch;
import org.lexis.search.model.SearchResponse;
import org.lexis.search.model.WildcardResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Search facade over the current index snapshot. Rebuilding constructs a complete new
 * snapshot and swaps it in; queries never see a partially built index.
 */
public class SearchService<D extends Comparable<? super D>> {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private final IndexingService indexingService;
	private final DocumentCollection<D> documents;
	private final int maxResults;
	private final AtomicReference<QueryService<D>> current = new AtomicReference<>();

	public SearchService(IndexingService indexingService, DocumentCollection<D> documents, int maxResults) {
		this.indexingService = indexingService;
		this.documents = documents;
		this.maxResults = maxResults;
	}

	/**
	 * Build a fresh snapshot from the document collection and make it current
	 */
	public IndexStats rebuild() throws IOException {
		IndexSnapshot<D> snapshot = indexingService.buildSnapshot(documents);
		current.set(new QueryService<>(snapshot));
		logger.info("Swapped in new index snapshot: {}", snapshot);
		return snapshot.stats();
	}

	public SearchResponse<D> search(BooleanOperator operator, List<String> words, Integer limit) {
		logger.info("Boolean query: operator={}, words={}, limit={}", operator, words, limit);

		List<Term> terms = normalizeAll(words);
		QueryService<D> queries = queries();
		Iterator<D> results;
		if (terms.isEmpty()) {
			results = List.<D>of().iterator();
		} else if (operator == BooleanOperator.AND) {
			results = queries.andAll(terms);
		} else {
			results = queries.orAll(terms);
		}
		return respond(String.join(" ", words), operator.name(), results, limit);
	}

	public SearchResponse<ProximityMatch<D>> near(String first, String second, int proximity, Integer limit) {
		logger.info("Proximity query: '{}' within {} of '{}', limit={}", first, proximity, second, limit);

		Term a = normalize(first);
		Term b = normalize(second);
		Iterator<ProximityMatch<D>> results = (a == null || b == null)
				? List.<ProximityMatch<D>>of().iterator()
				: queries().near(a, b, proximity);
		return respond(first + " " + second, "NEAR/" + proximity, results, limit);
	}

	public WildcardResponse<D> wildcard(String pattern, Integer limit) {
		logger.info("Wildcard query: '{}', limit={}", pattern, limit);

		String normalized = normalizePattern(pattern);
		QueryService<D> queries = queries();
		List<String> terms = queries.wildcardTerms(normalized).stream()
				.map(Term::text)
				.collect(Collectors.toList());
		SearchResponse<D> docs = respond(normalized, "WILDCARD", queries.wildcard(normalized), limit);
		return new WildcardResponse<>(normalized, terms, docs.returnedResults(), docs.truncated(), docs.results());
	}

	public List<Suggestion> suggest(String word, double maxDistance, Integer limit) {
		String normalized = normalizePattern(word);
		SpellingSuggester suggester =
				new SpellingSuggester(queries().snapshot().invertedIndex().vocabulary(), EditDistance.unitCost());
		return suggester.suggest(normalized, maxDistance, resultLimit(limit));
	}

	public DistanceResponse distance(String source, String dest) {
		EditDistance<Character> editDistance = EditDistance.unitCost();
		List<Character> from = EditDistance.chars(source);
		List<Character> to = EditDistance.chars(dest);
		var table = editDistance.table(from, to);
		return new DistanceResponse(source, dest, table.distance(), editDistance.align(table));
	}

	public IndexStats getStats() {
		return queries().snapshot().stats();
	}

	public boolean isReady() {
		return current.get() != null;
	}

	private QueryService<D> queries() {
		QueryService<D> queries = current.get();
		if (queries == null) {
			throw new IllegalStateException("Index has not been built yet");
		}
		return queries;
	}

	private <T> SearchResponse<T> respond(String query, String operator, Iterator<T> results, Integer limit) {
		int resultLimit = resultLimit(limit);
		// one extra element tells whether the result was cut off
		List<T> page = SortedMerge.stream(results)
				.limit(resultLimit + 1L)
				.collect(Collectors.toCollection(ArrayList::new));
		boolean truncated = page.size() > resultLimit;
		if (truncated) {
			page.remove(page.size() - 1);
		}
		return new SearchResponse<>(query, operator, page.size(), truncated, page);
	}

	private int resultLimit(Integer limit) {
		return (limit != null && limit > 0) ? Math.min(limit, maxResults) : maxResults;
	}

	private TextNormalizer normalizer() {
		return indexingService.normalizer();
	}

	private Term normalize(String word) {
		if (word == null) {
			return null;
		}
		String normalized = normalizer().normalizeToken(word.trim());
		return normalized == null ? null : Term.of(normalized);
	}

	private List<Term> normalizeAll(List<String> words) {
		List<Term> terms = new ArrayList<>(words.size());
		for (String word : words) {
			Term term = normalize(word);
			if (term != null) {
				terms.add(term);
			}
		}
		return terms;
	}

	private String normalizePattern(String pattern) {
		if (pattern == null || pattern.isBlank()) {
			throw new IllegalArgumentException("Pattern must not be empty");
		}
		String trimmed = pattern.trim();
		return normalizer().config().lowercase() ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
	}
}
