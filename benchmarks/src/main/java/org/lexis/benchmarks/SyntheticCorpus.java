package org.lexis.benchmarks;

import org.lexis.core.model.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Seeded random documents over a skewed vocabulary, so frequent terms get long posting lists.
 */
final class SyntheticCorpus {
	private static final String[] SYLLABLES = {
			"ca", "ro", "ta", "mi", "ne", "lo", "sa", "ri", "ve", "du", "ka", "pe", "zo", "li", "ba", "gu"
	};

	private SyntheticCorpus() {}

	static List<Term> vocabulary(int size, long seed) {
		Random random = new Random(seed);
		Set<Term> words = new LinkedHashSet<>(size);
		while (words.size() < size) {
			StringBuilder sb = new StringBuilder();
			int syllables = 1 + random.nextInt(4);
			for (int i = 0; i < syllables; i++) {
				sb.append(SYLLABLES[random.nextInt(SYLLABLES.length)]);
			}
			words.add(Term.of(sb.toString()));
		}
		return new ArrayList<>(words);
	}

	static Map<Integer, List<Term>> documents(List<Term> vocabulary, int documentCount, int wordsPerDocument, long seed) {
		Random random = new Random(seed);
		Map<Integer, List<Term>> documents = new HashMap<>();
		for (int docId = 0; docId < documentCount; docId++) {
			List<Term> terms = new ArrayList<>(wordsPerDocument);
			for (int i = 0; i < wordsPerDocument; i++) {
				terms.add(vocabulary.get(skewedIndex(random, vocabulary.size())));
			}
			documents.put(docId, terms);
		}
		return documents;
	}

	// squaring a uniform sample favors low indexes
	private static int skewedIndex(Random random, int size) {
		double u = random.nextDouble();
		return Math.min(size - 1, (int) (u * u * size));
	}
}
