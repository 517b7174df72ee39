package org.lexis.search.distance;

import java.util.List;

/**
 * Cost matrix of an edit-distance computation. Row {@code i} covers the first {@code i}
 * destination elements, column {@code j} the first {@code j} source elements.
 */
public final class EditDistanceTable<T> {
	private final List<T> source;
	private final List<T> dest;
	private final double[][] cells;

	EditDistanceTable(List<T> source, List<T> dest, double[][] cells) {
		this.source = source;
		this.dest = dest;
		this.cells = cells;
	}

	public double cost(int row, int column) {
		return cells[row][column];
	}

	/**
	 * Total cost, the bottom-right cell
	 */
	public double distance() {
		return cells[dest.size()][source.size()];
	}

	public int rows() {
		return dest.size() + 1;
	}

	public int columns() {
		return source.size() + 1;
	}

	public List<T> source() {
		return source;
	}

	public List<T> dest() {
		return dest;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (double[] row : cells) {
			for (int j = 0; j < row.length; j++) {
				if (j > 0) sb.append(' ');
				sb.append(row[j] == Math.rint(row[j]) ? String.valueOf((long) row[j]) : String.valueOf(row[j]));
			}
			sb.append('\n');
		}
		return sb.toString();
	}
}
