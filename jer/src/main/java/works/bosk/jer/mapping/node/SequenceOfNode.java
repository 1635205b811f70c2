package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.SizeRange;

import static java.util.Objects.requireNonNull;

public record SequenceOfNode(
	TypeNode element,
	SizeRange size
) implements CollectionNode {
	public SequenceOfNode {
		requireNonNull(element);
		requireNonNull(size);
	}

	@Override
	public String briefIdentifier() {
		return "SEQUENCE OF";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitSequenceOf(this, argument);
	}

	@Override
	public String toString() {
		return "SEQUENCE OF " + element;
	}
}
