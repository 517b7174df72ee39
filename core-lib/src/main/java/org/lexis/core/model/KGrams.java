package org.lexis.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-length character grams of a term padded with {@link #BOUNDARY} on both ends.
 */
public final class KGrams {
	public static final char BOUNDARY = '$';

	private KGrams() {}

	/**
	 * All {@code k}-character windows of {@code $text$}, left to right. Empty when the
	 * padded text is shorter than {@code k}.
	 */
	public static List<String> of(String text, int k) {
		if (k < 1) {
			throw new IllegalArgumentException("k must be at least 1, got " + k);
		}
		String padded = BOUNDARY + text + BOUNDARY;
		int count = padded.length() - k + 1;
		if (count <= 0) {
			return List.of();
		}
		List<String> grams = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			grams.add(padded.substring(i, i + k));
		}
		return grams;
	}

	public static List<String> of(Term term, int k) {
		return of(term.text(), k);
	}
}
