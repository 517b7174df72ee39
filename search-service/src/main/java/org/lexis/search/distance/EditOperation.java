package org.lexis.search.distance;

import org.jetbrains.annotations.NotNull;

/**
 * One step of an alignment. {@code source} is null for an insertion, {@code dest} is null
 * for a deletion; both are present for a match or substitution.
 */
public record EditOperation<T>(T source, T dest, double cost) {

	public enum Kind { MATCH, SUBSTITUTE, DELETE, INSERT }

	public EditOperation {
		if (source == null && dest == null) {
			throw new IllegalArgumentException("An edit operation needs a source or a destination element");
		}
	}

	public static <T> EditOperation<T> substitute(T source, T dest, double cost) {
		return new EditOperation<>(source, dest, cost);
	}

	public static <T> EditOperation<T> delete(T source, double cost) {
		return new EditOperation<>(source, null, cost);
	}

	public static <T> EditOperation<T> insert(T dest, double cost) {
		return new EditOperation<>(null, dest, cost);
	}

	public Kind kind() {
		if (source == null) return Kind.INSERT;
		if (dest == null) return Kind.DELETE;
		return source.equals(dest) ? Kind.MATCH : Kind.SUBSTITUTE;
	}

	@NotNull
	@Override
	public String toString() {
		return "(" + (source == null ? "-" : source) + "," + (dest == null ? "-" : dest) + ")";
	}
}
