package works.bosk.jer.descriptor;

import works.bosk.jer.mapping.Nullable;

/**
 * Declared size bounds of a string or collection type.
 * A null bound means unconstrained in that direction.
 */
public record SizeRange(
	@Nullable Long minimum,
	@Nullable Long maximum
) {
	public SizeRange {
		if (minimum != null && maximum != null && minimum > maximum) {
			throw new IllegalArgumentException("Size minimum " + minimum + " exceeds maximum " + maximum);
		}
	}

	public static final SizeRange UNCONSTRAINED = new SizeRange(null, null);

	public static SizeRange of(long minimum, long maximum) {
		return new SizeRange(minimum, maximum);
	}

	public static SizeRange fixed(long size) {
		return new SizeRange(size, size);
	}

	public boolean isFixed() {
		return minimum != null && minimum.equals(maximum);
	}

	@Override
	public String toString() {
		return "SIZE(" + (minimum == null ? "MIN" : minimum) + ".." + (maximum == null ? "MAX" : maximum) + ")";
	}
}
