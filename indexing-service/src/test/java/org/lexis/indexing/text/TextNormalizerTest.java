package org.lexis.indexing.text;

import org.junit.jupiter.api.Test;
import org.lexis.core.model.Term;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerTest {

	@Test
	public void testLowercasesAndStripsPunctuation() {
		TextNormalizer normalizer = new TextNormalizer(NormalizationConfig.defaults());

		assertEquals(Term.listOf("hello", "world", "its", "42"), normalizer.normalize("  Hello, World!\n It's 42 "));
	}

	@Test
	public void testTokensThatNormalizeAwayAreDropped() {
		TextNormalizer normalizer = new TextNormalizer(NormalizationConfig.defaults());

		assertEquals(Term.listOf("a", "b"), normalizer.normalize("a -- b ..."));
		assertEquals(List.of(), normalizer.normalize(""));
	}

	@Test
	public void testEnglishStopWordsAreRemoved() {
		TextNormalizer normalizer = new TextNormalizer(NormalizationConfig.english());

		assertEquals(Term.listOf("cat", "mat"), normalizer.normalize("The cat is on the mat"));
	}

	@Test
	public void testReplacementsBypassDefaultNormalization() {
		NormalizationConfig config = NormalizationConfig.defaults().withReplacement("Paris", "Paris");
		TextNormalizer normalizer = new TextNormalizer(config);

		assertEquals(Term.listOf("visit", "Paris", "paris"), normalizer.normalize("Visit Paris PARIS"));
	}

	@Test
	public void testCaseIsKeptWhenLowercasingDisabled() {
		TextNormalizer normalizer = new TextNormalizer(new NormalizationConfig(false, Set.of(), Map.of()));

		assertEquals(Term.listOf("Alice", "Rabbit"), normalizer.normalize("Alice Rabbit."));
	}

	@Test
	public void testStopWordsParser() {
		Set<String> stopWords = NormalizationConfig.parseStopWords("the,a,an,and,or,but");

		assertEquals(6, stopWords.size());
		assertTrue(stopWords.contains("the"));
		assertFalse(stopWords.contains("hello"));
		assertEquals(0, NormalizationConfig.parseStopWords("").size());
		assertEquals(0, NormalizationConfig.parseStopWords(null).size());
	}

	@Test
	public void testReplacementsParser() {
		assertEquals(Map.of("NYC", "newyork", "US", "usa"), NormalizationConfig.parseReplacements("NYC=newyork, US=usa"));
		assertThrows(IllegalArgumentException.class, () -> NormalizationConfig.parseReplacements("broken"));
	}

	@Test
	public void testProviderReturnsEmptyStreamForUnknownDocument() {
		TermStreamProvider<Integer> provider =
				TermStreamProvider.of(Map.of(1, "one two"), new TextNormalizer(NormalizationConfig.defaults()));

		assertEquals(Term.listOf("one", "two"), provider.terms(1));
		assertEquals(provider.terms(1), provider.terms(1));
		assertEquals(List.of(), provider.terms(2));
	}
}
