package org.lexis.indexing.model;

public record IndexStats(
		int documents,
		int uniqueTerms,
		long totalPostings,
		int k,
		int kgrams,
		String builtAt
) {}
