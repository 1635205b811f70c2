package works.bosk.jer;

import java.util.Arrays;
import java.util.HexFormat;

import static java.util.Objects.requireNonNull;

/**
 * The native value of a BIT STRING: {@code length} bits, most significant first,
 * packed into {@code bytes}. Bits past {@code length} in the last byte are ignored
 * by {@link #equals} and are cleared by the constructor.
 */
public record BitString(byte[] bytes, int length) {
	public BitString {
		requireNonNull(bytes);
		if (length < 0) {
			throw new IllegalArgumentException("Negative bit string length " + length);
		}
		if (bytes.length != byteCount(length)) {
			throw new IllegalArgumentException(
				"A bit string of length " + length + " needs " + byteCount(length) + " bytes, not " + bytes.length);
		}
		bytes = bytes.clone();
		int unusedBits = bytes.length * 8 - length;
		if (unusedBits > 0) {
			bytes[bytes.length - 1] &= (byte) (0xFF << unusedBits);
		}
	}

	/**
	 * @return all {@code bytes.length * 8} bits
	 */
	public static BitString of(byte... bytes) {
		return new BitString(bytes, bytes.length * 8);
	}

	@Override
	public byte[] bytes() {
		return bytes.clone();
	}

	public boolean get(int index) {
		if (index < 0 || index >= length) {
			throw new IndexOutOfBoundsException("Bit " + index + " of " + length);
		}
		return (bytes[index / 8] & (0x80 >>> (index % 8))) != 0;
	}

	public static int byteCount(int length) {
		return (length + 7) / 8;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BitString other
			&& length == other.length
			&& Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(bytes) + length;
	}

	@Override
	public String toString() {
		return "BitString(" + HexFormat.of().withUpperCase().formatHex(bytes) + ", " + length + ")";
	}
}
