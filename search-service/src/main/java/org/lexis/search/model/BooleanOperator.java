package org.lexis.search.model;

public enum BooleanOperator {
	AND,
	OR
}
