package org.lexis.core.compression;

import org.lexis.core.model.InvertedIndex;
import org.lexis.core.model.PostingList;
import org.lexis.core.model.Term;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Delta encoding of strictly ascending, non-negative integer sequences.
 *
 * <p>The first gap is the first value itself. Malformed input is rejected with
 * {@link IllegalArgumentException} in both directions.</p>
 */
public final class GapCodec {
	private GapCodec() {}

	/**
	 * Convert ascending values to gaps
	 *
	 * @param values strictly ascending non-negative values
	 * @return gaps whose running sum reproduces {@code values}
	 */
	public static int[] encode(int[] values) {
		int[] gaps = new int[values.length];
		int offset = 0;
		for (int i = 0; i < values.length; i++) {
			int value = values[i];
			if (value < 0) {
				throw new IllegalArgumentException("Cannot gap-encode negative value " + value + " at position " + i);
			}
			if (i > 0 && value <= offset) {
				throw new IllegalArgumentException(
						"Cannot gap-encode non-ascending values: " + offset + " followed by " + value + " at position " + i);
			}
			gaps[i] = value - offset;
			offset = value;
		}
		return gaps;
	}

	public static int[] encode(List<Integer> values) {
		return encode(values.stream().mapToInt(Integer::intValue).toArray());
	}

	/**
	 * Convert gaps back to values by running sum
	 */
	public static int[] decode(int[] gaps) {
		int[] values = new int[gaps.length];
		int offset = 0;
		for (int i = 0; i < gaps.length; i++) {
			int gap = gaps[i];
			if (gap < 0 || (i > 0 && gap == 0)) {
				throw new IllegalArgumentException("Invalid gap " + gap + " at position " + i);
			}
			try {
				offset = Math.addExact(offset, gap);
			} catch (ArithmeticException e) {
				throw new IllegalArgumentException("Gap sequence overflows int at position " + i, e);
			}
			values[i] = offset;
		}
		return values;
	}

	/**
	 * Gap-encode every posting list of an index
	 */
	public static Map<Term, int[]> encodeIndex(InvertedIndex<Integer> index) {
		Map<Term, int[]> result = new TreeMap<>();
		for (Map.Entry<Term, PostingList<Integer>> entry : index.asMap().entrySet()) {
			result.put(entry.getKey(), encode(entry.getValue().docIds()));
		}
		return result;
	}

	/**
	 * Rebuild a posting list from its gaps
	 */
	public static PostingList<Integer> decodePostings(int[] gaps) {
		int[] values = decode(gaps);
		Integer[] boxed = new Integer[values.length];
		for (int i = 0; i < values.length; i++) {
			boxed[i] = values[i];
		}
		return PostingList.of(boxed);
	}
}
