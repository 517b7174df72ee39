package org.lexis.search.service;

import org.lexis.core.merge.SortedMerge;
import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.KGramIndex;
import org.lexis.core.model.KGrams;
import org.lexis.core.model.PostingList;
import org.lexis.core.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves a {@code *} wildcard pattern to vocabulary terms through a k-gram index, then to documents.
 *
 * <p>Candidates are the intersection of the term lists of every gram of the padded pattern that
 * contains no {@code *}. When the pattern has no such gram, every vocabulary term is a candidate.
 * Candidates are then checked against the whole pattern, where {@code *} matches any run of zero
 * or more characters and everything else is literal.</p>
 */
public class WildcardMatcher<D extends Comparable<? super D>> {
	private static final Logger logger = LoggerFactory.getLogger(WildcardMatcher.class);

	public static final char WILDCARD = '*';

	private final InvertedIndex<D> index;
	private final KGramIndex kgramIndex;

	public WildcardMatcher(InvertedIndex<D> index, KGramIndex kgramIndex) {
		this.index = index;
		this.kgramIndex = kgramIndex;
	}

	/**
	 * Grams of the padded pattern that contain no wildcard
	 */
	public List<String> literalGrams(String pattern) {
		List<String> grams = new ArrayList<>();
		for (String gram : KGrams.of(pattern, kgramIndex.k())) {
			if (gram.indexOf(WILDCARD) < 0) {
				grams.add(gram);
			}
		}
		return grams;
	}

	/**
	 * Vocabulary terms matching the pattern, ascending
	 */
	public List<Term> matchingTerms(String pattern) {
		validate(pattern);
		List<String> grams = literalGrams(pattern);

		Iterator<Term> candidates;
		if (grams.isEmpty()) {
			logger.debug("Pattern '{}' has no literal {}-gram, scanning the whole vocabulary", pattern, kgramIndex.k());
			candidates = index.vocabulary().iterator();
		} else {
			List<List<Term>> lists = new ArrayList<>(grams.size());
			for (String gram : grams) {
				lists.add(kgramIndex.candidates(gram));
			}
			candidates = SortedMerge.intersectAll(lists);
		}

		Pattern glob = toRegex(pattern);
		List<Term> matches = new ArrayList<>();
		int examined = 0;
		while (candidates.hasNext()) {
			Term candidate = candidates.next();
			examined++;
			if (glob.matcher(candidate.text()).matches()) {
				matches.add(candidate);
			}
		}

		logger.debug("Pattern '{}': {} grams, {} candidates, {} matching terms", pattern, grams.size(), examined, matches.size());
		return matches;
	}

	/**
	 * Documents containing any term that matches the pattern, ascending and unique
	 */
	public Iterator<D> query(String pattern) {
		List<PostingList<D>> postings = new ArrayList<>();
		for (Term term : matchingTerms(pattern)) {
			postings.add(index.postings(term));
		}
		return SortedMerge.unionAll(postings);
	}

	/**
	 * Anchored glob match of a single term
	 */
	public static boolean matches(String pattern, String term) {
		return toRegex(pattern).matcher(term).matches();
	}

	static Pattern toRegex(String pattern) {
		StringBuilder regex = new StringBuilder();
		int start = 0;
		for (int i = 0; i < pattern.length(); i++) {
			if (pattern.charAt(i) == WILDCARD) {
				appendLiteral(regex, pattern.substring(start, i));
				regex.append(".*");
				start = i + 1;
			}
		}
		appendLiteral(regex, pattern.substring(start));
		return Pattern.compile(regex.toString(), Pattern.DOTALL);
	}

	private static void appendLiteral(StringBuilder regex, String literal) {
		if (!literal.isEmpty()) {
			regex.append(Pattern.quote(literal));
		}
	}

	private static void validate(String pattern) {
		if (pattern == null) {
			throw new IllegalArgumentException("Wildcard pattern must not be null");
		}
		if (pattern.indexOf(KGrams.BOUNDARY) >= 0) {
			throw new IllegalArgumentException(
					"Wildcard pattern must not contain the boundary character '" + KGrams.BOUNDARY + "': " + pattern);
		}
	}
}
