package org.lexis.core.compression;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Variable-length byte packing of non-negative ints: seven payload bits per byte,
 * low-order group first, high bit set on every byte except the last of a value.
 */
public final class VariableByteCodec {
	private VariableByteCodec() {}

	public static byte[] pack(int[] values) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(values.length);
		for (int i = 0; i < values.length; i++) {
			int value = values[i];
			if (value < 0) {
				throw new IllegalArgumentException("Cannot pack negative value " + value + " at position " + i);
			}
			while ((value & ~0x7F) != 0) {
				out.write((value & 0x7F) | 0x80);
				value >>>= 7;
			}
			out.write(value);
		}
		return out.toByteArray();
	}

	public static int[] unpack(byte[] bytes) {
		int[] values = new int[bytes.length];
		int count = 0;
		int pos = 0;
		while (pos < bytes.length) {
			int value = 0;
			int shift = 0;
			byte b;
			do {
				if (pos == bytes.length) {
					throw new IllegalArgumentException("Truncated variable-byte value at offset " + pos);
				}
				if (shift > 28) {
					throw new IllegalArgumentException("Variable-byte value too long at offset " + pos);
				}
				b = bytes[pos++];
				// the fifth group carries bits 28-30 only; anything above would leave the non-negative int range
				if (shift == 28 && (b & 0x7F) > 0x07) {
					throw new IllegalArgumentException("Variable-byte value exceeds int range at offset " + (pos - 1));
				}
				value |= (b & 0x7F) << shift;
				shift += 7;
			} while ((b & 0x80) != 0);
			values[count++] = value;
		}
		return Arrays.copyOf(values, count);
	}

	/**
	 * Gap-encode ascending values and pack the gaps
	 */
	public static byte[] packPostings(int[] ascendingValues) {
		return pack(GapCodec.encode(ascendingValues));
	}

	public static int[] unpackPostings(byte[] bytes) {
		return GapCodec.decode(unpack(bytes));
	}
}
