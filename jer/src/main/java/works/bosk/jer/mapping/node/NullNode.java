package works.bosk.jer.mapping.node;

/**
 * NULL, represented as a JSON null.
 */
public record NullNode() implements ScalarNode {
	@Override
	public String briefIdentifier() {
		return "NULL";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitNull(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
