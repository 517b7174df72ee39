package org.lexis.indexing.text;

import org.lexis.core.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw text into a term stream: whitespace tokenization, explicit replacements,
 * lowercasing, removal of non-word characters, and stop-word filtering.
 */
public class TextNormalizer {
	private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern NON_WORD = Pattern.compile("\\W", Pattern.UNICODE_CHARACTER_CLASS);

	private final NormalizationConfig config;

	public TextNormalizer(NormalizationConfig config) {
		this.config = config;
	}

	public NormalizationConfig config() {
		return config;
	}

	/**
	 * Split on whitespace, dropping empty tokens
	 */
	public static List<String> tokenize(String text) {
		List<String> tokens = new ArrayList<>();
		for (String token : WHITESPACE.split(text)) {
			if (!token.isEmpty()) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	public static String stripPunctuation(String token) {
		return NON_WORD.matcher(token).replaceAll("");
	}

	/**
	 * Normalize a single raw token, or return null when it normalizes away
	 */
	public String normalizeToken(String token) {
		String replacement = config.replacements().get(token);
		String normalized;
		if (replacement != null) {
			normalized = replacement;
		} else {
			normalized = stripPunctuation(config.lowercase() ? token.toLowerCase(Locale.ROOT) : token);
		}

		if (normalized.isEmpty() || config.stopWords().contains(normalized)) {
			return null;
		}
		return normalized;
	}

	public List<Term> normalize(String text) {
		List<String> tokens = tokenize(text);
		List<Term> terms = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			String normalized = normalizeToken(token);
			if (normalized != null) {
				terms.add(Term.of(normalized));
			}
		}
		logger.trace("Normalized {} tokens into {} terms", tokens.size(), terms.size());
		return terms;
	}
}
