package org.lexis.search.distance;

import org.lexis.core.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Suggests vocabulary terms close to a possibly misspelled query term.
 */
public class SpellingSuggester {
	private static final Logger logger = LoggerFactory.getLogger(SpellingSuggester.class);

	private final Iterable<Term> vocabulary;
	private final EditDistance<Character> editDistance;

	public SpellingSuggester(Iterable<Term> vocabulary, EditDistance<Character> editDistance) {
		this.vocabulary = vocabulary;
		this.editDistance = editDistance;
	}

	/**
	 * Terms within {@code maxDistance} of {@code query}, closest first, ties by term order
	 */
	public List<Suggestion> suggest(String query, double maxDistance, int limit) {
		if (maxDistance < 0) {
			throw new IllegalArgumentException("maxDistance must be non-negative, got " + maxDistance);
		}
		if (limit <= 0) {
			return List.of();
		}

		List<Character> target = EditDistance.chars(query);
		List<Suggestion> within = new ArrayList<>();
		for (Term term : vocabulary) {
			double distance = editDistance.distance(target, EditDistance.chars(term.text()));
			if (distance <= maxDistance) {
				within.add(new Suggestion(term.text(), distance));
			}
		}

		List<Suggestion> result = within.stream()
				.sorted(Comparator.comparingDouble(Suggestion::distance).thenComparing(s -> Term.of(s.term())))
				.limit(limit)
				.collect(Collectors.toList());
		logger.debug("Suggestions for '{}' within {}: {}", query, maxDistance, result.size());
		return result;
	}
}
