package org.lexis.search.model;

import java.util.List;

public record WildcardResponse<D>(
		String pattern,
		List<String> matchedTerms,
		int returnedResults,
		boolean truncated,
		List<D> results
) {}
