package org.lexis.search.distance;

public record Suggestion(String term, double distance) {}
