package org.lexis.search.model;

import org.lexis.search.distance.EditOperation;

import java.util.List;

public record DistanceResponse(
		String source,
		String dest,
		double distance,
		List<EditOperation<Character>> alignment
) {}
