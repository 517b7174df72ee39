package org.lexis.search.distance;

import java.util.Objects;
import java.util.function.ToDoubleBiFunction;
import java.util.function.ToDoubleFunction;

/**
 * Per-element costs of the three edit operations.
 *
 * @param insert cost of inserting a destination element
 * @param delete cost of deleting a source element
 * @param substitute cost of replacing a source element with a destination element
 */
public record EditCosts<T>(
		ToDoubleFunction<? super T> insert,
		ToDoubleFunction<? super T> delete,
		ToDoubleBiFunction<? super T, ? super T> substitute
) {
	public EditCosts {
		Objects.requireNonNull(insert, "insert");
		Objects.requireNonNull(delete, "delete");
		Objects.requireNonNull(substitute, "substitute");
	}

	/**
	 * Levenshtein costs: 1 per insertion, deletion or substitution of unequal elements
	 */
	public static <T> EditCosts<T> unit() {
		return new EditCosts<>(x -> 1.0, x -> 1.0, (a, b) -> Objects.equals(a, b) ? 0.0 : 1.0);
	}

	public EditCosts<T> withInsert(ToDoubleFunction<? super T> cost) {
		return new EditCosts<>(cost, delete, substitute);
	}

	public EditCosts<T> withDelete(ToDoubleFunction<? super T> cost) {
		return new EditCosts<>(insert, cost, substitute);
	}

	public EditCosts<T> withSubstitute(ToDoubleBiFunction<? super T, ? super T> cost) {
		return new EditCosts<>(insert, delete, cost);
	}

	double insertCost(T element) {
		return checked(insert.applyAsDouble(element), "insert", element);
	}

	double deleteCost(T element) {
		return checked(delete.applyAsDouble(element), "delete", element);
	}

	double substituteCost(T from, T to) {
		return checked(substitute.applyAsDouble(from, to), "substitute", from + "->" + to);
	}

	private static double checked(double cost, String operation, Object subject) {
		if (cost < 0 || Double.isNaN(cost)) {
			throw new IllegalArgumentException("Negative or undefined " + operation + " cost " + cost + " for " + subject);
		}
		return cost;
	}
}
