package org.lexis.indexing.text;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings for {@link TextNormalizer}.
 *
 * @param lowercase fold tokens to lower case before stripping punctuation
 * @param stopWords normalized terms dropped from the stream
 * @param replacements raw tokens mapped straight to a replacement term, bypassing the default normalization
 */
public record NormalizationConfig(boolean lowercase, Set<String> stopWords, Map<String, String> replacements) {

	/** Common English stop words, from Manning, Raghavan and Schütze (2008), Introduction to Information Retrieval, p. 26 */
	public static final List<String> ENGLISH_STOP_WORDS = List.of(
			"a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is", "it",
			"its", "of", "on", "that", "the", "to", "was", "were", "will", "with");

	public NormalizationConfig {
		stopWords = Set.copyOf(stopWords);
		replacements = Map.copyOf(replacements);
	}

	/**
	 * Lowercasing and punctuation stripping only
	 */
	public static NormalizationConfig defaults() {
		return new NormalizationConfig(true, Set.of(), Map.of());
	}

	public static NormalizationConfig english() {
		return new NormalizationConfig(true, new HashSet<>(ENGLISH_STOP_WORDS), Map.of());
	}

	public NormalizationConfig withReplacement(String token, String replacement) {
		Map<String, String> copy = new HashMap<>(replacements);
		copy.put(token, replacement);
		return new NormalizationConfig(lowercase, stopWords, copy);
	}

	/**
	 * Parse stop words from comma-separated string
	 */
	public static Set<String> parseStopWords(String stopWordsStr) {
		if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
			return new HashSet<>();
		}

		Set<String> stopWords = new HashSet<>();
		for (String word : stopWordsStr.split(",")) {
			String cleaned = word.trim().toLowerCase();
			if (!cleaned.isEmpty()) {
				stopWords.add(cleaned);
			}
		}
		return stopWords;
	}

	/**
	 * Parse {@code token=replacement} pairs from a comma-separated string
	 */
	public static Map<String, String> parseReplacements(String replacementsStr) {
		Map<String, String> replacements = new HashMap<>();
		if (replacementsStr == null || replacementsStr.isBlank()) {
			return replacements;
		}

		Arrays.stream(replacementsStr.split(","))
				.map(String::trim)
				.filter(pair -> !pair.isEmpty())
				.forEach(pair -> {
					int eq = pair.indexOf('=');
					if (eq <= 0 || eq == pair.length() - 1) {
						throw new IllegalArgumentException("Invalid replacement '" + pair + "', expected token=replacement");
					}
					replacements.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
				});
		return replacements;
	}
}
