package org.lexis.benchmarks;

import org.lexis.core.model.Term;
import org.lexis.indexing.model.IndexSnapshot;
import org.lexis.indexing.service.IndexingService;
import org.lexis.indexing.text.NormalizationConfig;
import org.lexis.indexing.text.TextNormalizer;
import org.lexis.search.distance.EditDistance;
import org.lexis.search.distance.SpellingSuggester;
import org.lexis.search.service.QueryService;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for query evaluation over a prebuilt snapshot
 * Tests: boolean merges, proximity, wildcard, spelling suggestions
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class QueryBenchmark {

	private List<Term> vocabulary;
	private QueryService<Integer> queries;
	private SpellingSuggester suggester;

	private Term frequent;
	private Term common;
	private Term rare;

	@Param({"1000", "10000"})
	private int documentCount;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Query Benchmark Setup (documentCount=" + documentCount + ") ===");

		vocabulary = SyntheticCorpus.vocabulary(5_000, 42L);
		IndexingService indexingService = new IndexingService(new TextNormalizer(NormalizationConfig.defaults()), 2);
		IndexSnapshot<Integer> snapshot =
				indexingService.buildSnapshot(SyntheticCorpus.documents(vocabulary, documentCount, 200, 7L));
		queries = new QueryService<>(snapshot);
		suggester = new SpellingSuggester(snapshot.invertedIndex().vocabulary(), EditDistance.unitCost());

		frequent = vocabulary.get(0);
		common = vocabulary.get(50);
		rare = vocabulary.get(vocabulary.size() - 1);

		System.out.println("Snapshot ready: " + snapshot);
	}

	@Benchmark
	public void intersectFrequentTerms(Blackhole blackhole) {
		drain(queries.and(frequent, common), blackhole);
	}

	@Benchmark
	public void intersectFrequentWithRare(Blackhole blackhole) {
		drain(queries.and(frequent, rare), blackhole);
	}

	@Benchmark
	public void unionFrequentTerms(Blackhole blackhole) {
		drain(queries.or(frequent, common), blackhole);
	}

	@Benchmark
	public void intersectThreeTerms(Blackhole blackhole) {
		drain(queries.andAll(List.of(frequent, common, vocabulary.get(10))), blackhole);
	}

	@Benchmark
	public void proximityWithinThree(Blackhole blackhole) {
		drain(queries.near(frequent, common, 3), blackhole);
	}

	@Benchmark
	public void prefixWildcard(Blackhole blackhole) {
		drain(queries.wildcard("caro*"), blackhole);
	}

	@Benchmark
	public void infixWildcard(Blackhole blackhole) {
		drain(queries.wildcard("ca*ri*"), blackhole);
	}

	/**
	 * Benchmark: Scan the whole vocabulary for terms within distance 2
	 */
	@Benchmark
	public void suggestSpelling(Blackhole blackhole) {
		blackhole.consume(suggester.suggest("carotami", 2, 10));
	}

	private static <T> void drain(Iterator<T> results, Blackhole blackhole) {
		while (results.hasNext()) {
			blackhole.consume(results.next());
		}
	}
}
