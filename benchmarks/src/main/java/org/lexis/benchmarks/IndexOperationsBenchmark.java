package org.lexis.benchmarks;

import org.lexis.core.compression.GapCodec;
import org.lexis.core.compression.VariableByteCodec;
import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.Term;
import org.lexis.indexing.service.InvertedIndexBuilder;
import org.lexis.indexing.service.KGramIndexBuilder;
import org.lexis.indexing.service.PositionalIndexBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for index construction and posting compression
 * Tests: inverted, positional and k-gram builds, gap and variable-byte encoding
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private static final int VOCABULARY_SIZE = 5_000;
	private static final int WORDS_PER_DOCUMENT = 200;

	private final InvertedIndexBuilder invertedIndexBuilder = new InvertedIndexBuilder();
	private final PositionalIndexBuilder positionalIndexBuilder = new PositionalIndexBuilder();
	private final KGramIndexBuilder kgramIndexBuilder = new KGramIndexBuilder(2);

	private List<Term> vocabulary;
	private Map<Integer, List<Term>> documents;
	private InvertedIndex<Integer> preBuiltIndex;
	private int[] longestPostings;

	@Param({"100", "1000", "5000"})
	private int documentCount;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Index Operations Benchmark Setup (documentCount=" + documentCount + ") ===");

		vocabulary = SyntheticCorpus.vocabulary(VOCABULARY_SIZE, 42L);
		documents = SyntheticCorpus.documents(vocabulary, documentCount, WORDS_PER_DOCUMENT, 7L);
		preBuiltIndex = invertedIndexBuilder.build(documents);
		longestPostings = preBuiltIndex.postings(vocabulary.get(0)).stream().mapToInt(Integer::intValue).toArray();

		System.out.println("Index ready: " + preBuiltIndex.termCount() + " unique terms");
	}

	@Benchmark
	public void buildInvertedIndex(Blackhole blackhole) {
		blackhole.consume(invertedIndexBuilder.build(documents));
	}

	@Benchmark
	public void buildPositionalIndex(Blackhole blackhole) {
		blackhole.consume(positionalIndexBuilder.build(documents));
	}

	@Benchmark
	public void buildKGramIndex(Blackhole blackhole) {
		blackhole.consume(kgramIndexBuilder.build(preBuiltIndex.vocabulary()));
	}

	/**
	 * Benchmark: Gap-encode every posting list of the index
	 */
	@Benchmark
	public void gapEncodeIndex(Blackhole blackhole) {
		blackhole.consume(GapCodec.encodeIndex(preBuiltIndex));
	}

	@Benchmark
	public void variableBytePackLongestList(Blackhole blackhole) {
		blackhole.consume(VariableByteCodec.packPostings(longestPostings));
	}
}
