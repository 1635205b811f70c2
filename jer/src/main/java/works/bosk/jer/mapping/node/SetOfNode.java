package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.SizeRange;

import static java.util.Objects.requireNonNull;

/**
 * SET OF. Element order is not significant in ASN.1, but JSON arrays are ordered,
 * so the native order is kept rather than sorted.
 */
public record SetOfNode(
	TypeNode element,
	SizeRange size
) implements CollectionNode {
	public SetOfNode {
		requireNonNull(element);
		requireNonNull(size);
	}

	@Override
	public String briefIdentifier() {
		return "SET OF";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitSetOf(this, argument);
	}

	@Override
	public String toString() {
		return "SET OF " + element;
	}
}
