package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.SizeRange;

import static java.util.Objects.requireNonNull;

/**
 * OCTET STRING, represented as a JSON string of hexadecimal digits, two per octet.
 */
public record OctetStringNode(
	SizeRange size
) implements ScalarNode {
	public OctetStringNode {
		requireNonNull(size);
	}

	@Override
	public String briefIdentifier() {
		return "OCTET STRING";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitOctetString(this, argument);
	}

	@Override
	public String toString() {
		return size.equals(SizeRange.UNCONSTRAINED) ? briefIdentifier() : briefIdentifier() + " " + size;
	}
}
