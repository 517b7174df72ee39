package org.lexis.search.distance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Weighted edit distance with backtrace.
 *
 * <p>When several predecessors of a cell lie on an optimal path the backtrace prefers
 * substitution, then deletion, then insertion. That order decides which of several optimal
 * alignments is returned.</p>
 */
public class EditDistance<T> {
	private static final double EPSILON = 1e-9;

	private final EditCosts<T> costs;

	public EditDistance(EditCosts<T> costs) {
		this.costs = costs;
	}

	public static <T> EditDistance<T> unitCost() {
		return new EditDistance<>(EditCosts.unit());
	}

	public EditDistanceTable<T> table(List<T> source, List<T> dest) {
		List<T> from = List.copyOf(source);
		List<T> to = List.copyOf(dest);
		int rows = to.size() + 1;
		int columns = from.size() + 1;
		double[][] cells = new double[rows][columns];

		for (int j = 1; j < columns; j++) {
			cells[0][j] = cells[0][j - 1] + costs.deleteCost(from.get(j - 1));
		}
		for (int i = 1; i < rows; i++) {
			cells[i][0] = cells[i - 1][0] + costs.insertCost(to.get(i - 1));
		}

		for (int i = 1; i < rows; i++) {
			for (int j = 1; j < columns; j++) {
				double substitute = cells[i - 1][j - 1] + costs.substituteCost(from.get(j - 1), to.get(i - 1));
				double delete = cells[i][j - 1] + costs.deleteCost(from.get(j - 1));
				double insert = cells[i - 1][j] + costs.insertCost(to.get(i - 1));
				cells[i][j] = Math.min(substitute, Math.min(delete, insert));
			}
		}
		return new EditDistanceTable<>(from, to, cells);
	}

	public double distance(List<T> source, List<T> dest) {
		return table(source, dest).distance();
	}

	public List<EditOperation<T>> align(List<T> source, List<T> dest) {
		return align(table(source, dest));
	}

	/**
	 * Walk back from the bottom-right cell to the origin
	 */
	public List<EditOperation<T>> align(EditDistanceTable<T> table) {
		List<T> from = table.source();
		List<T> to = table.dest();
		List<EditOperation<T>> operations = new ArrayList<>(Math.max(from.size(), to.size()));
		int i = to.size();
		int j = from.size();

		while (i > 0 || j > 0) {
			double current = table.cost(i, j);
			if (i > 0 && j > 0) {
				double step = costs.substituteCost(from.get(j - 1), to.get(i - 1));
				if (sameCost(table.cost(i - 1, j - 1) + step, current)) {
					operations.add(EditOperation.substitute(from.get(j - 1), to.get(i - 1), step));
					i--;
					j--;
					continue;
				}
			}
			if (j > 0) {
				double step = costs.deleteCost(from.get(j - 1));
				if (sameCost(table.cost(i, j - 1) + step, current)) {
					operations.add(EditOperation.delete(from.get(j - 1), step));
					j--;
					continue;
				}
			}
			if (i > 0) {
				double step = costs.insertCost(to.get(i - 1));
				if (sameCost(table.cost(i - 1, j) + step, current)) {
					operations.add(EditOperation.insert(to.get(i - 1), step));
					i--;
					continue;
				}
			}
			throw new IllegalStateException("Edit distance table is inconsistent at row " + i + ", column " + j);
		}

		Collections.reverse(operations);
		return operations;
	}

	/**
	 * Levenshtein distance between two strings
	 */
	public static int levenshtein(String source, String dest) {
		return (int) Math.round(EditDistance.<Character>unitCost().distance(chars(source), chars(dest)));
	}

	public static List<EditOperation<Character>> alignStrings(String source, String dest) {
		return EditDistance.<Character>unitCost().align(chars(source), chars(dest));
	}

	public static List<Character> chars(String text) {
		List<Character> chars = new ArrayList<>(text.length());
		for (int i = 0; i < text.length(); i++) {
			chars.add(text.charAt(i));
		}
		return chars;
	}

	private static boolean sameCost(double a, double b) {
		return Math.abs(a - b) <= EPSILON * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
	}
}
