package org.lexis.search.model;

import java.util.List;

public record SearchResponse<T>(
		String query,
		String operator,
		int returnedResults,
		boolean truncated,
		List<T> results
) {}
