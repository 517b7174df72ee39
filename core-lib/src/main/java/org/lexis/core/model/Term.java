package org.lexis.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A normalized index term. Equality and hashing are by value; ordering is by
 * Unicode code point.
 */
public record Term(String text) implements Comparable<Term> {

	public Term {
		if (text == null) {
			throw new IllegalArgumentException("Term text must not be null");
		}
	}

	public static Term of(String text) {
		return new Term(text);
	}

	/**
	 * Wrap a sequence of already-normalized strings
	 */
	public static List<Term> listOf(String... texts) {
		List<Term> terms = new ArrayList<>(texts.length);
		for (String text : texts) {
			terms.add(new Term(text));
		}
		return terms;
	}

	/**
	 * Unicode code point order. Unlike {@link String#compareTo(String)}, supplementary
	 * characters sort after every BMP character, including U+E000 to U+FFFF.
	 */
	@Override
	public int compareTo(@NotNull Term other) {
		String a = text;
		String b = other.text;
		int i = 0;
		int j = 0;
		while (i < a.length() && j < b.length()) {
			int ca = a.codePointAt(i);
			int cb = b.codePointAt(j);
			if (ca != cb) {
				return Integer.compare(ca, cb);
			}
			i += Character.charCount(ca);
			j += Character.charCount(cb);
		}
		return Boolean.compare(i < a.length(), j < b.length());
	}

	@NotNull
	@Override
	public String toString() {
		return text;
	}
}
