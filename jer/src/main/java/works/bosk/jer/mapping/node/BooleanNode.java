package works.bosk.jer.mapping.node;

/**
 * BOOLEAN, represented as a JSON boolean.
 */
public record BooleanNode() implements ScalarNode {
	@Override
	public String briefIdentifier() {
		return "BOOLEAN";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitBoolean(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
