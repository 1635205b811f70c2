package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.SizeRange;

import static java.util.Objects.requireNonNull;

/**
 * BIT STRING, represented as a JSON object with a hexadecimal {@value #VALUE_MEMBER}
 * member and an integer {@value #LENGTH_MEMBER} member giving the number of bits.
 * The representation is the same for every {@link #size}.
 */
public record BitStringNode(
	SizeRange size
) implements ScalarNode {
	public static final String VALUE_MEMBER = "value";
	public static final String LENGTH_MEMBER = "length";

	public BitStringNode {
		requireNonNull(size);
	}

	@Override
	public String briefIdentifier() {
		return "BIT STRING";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitBitString(this, argument);
	}

	@Override
	public String toString() {
		return size.equals(SizeRange.UNCONSTRAINED) ? briefIdentifier() : briefIdentifier() + " " + size;
	}
}
