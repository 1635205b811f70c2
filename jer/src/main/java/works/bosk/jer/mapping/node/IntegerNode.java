package works.bosk.jer.mapping.node;

/**
 * INTEGER, represented as a JSON number with no fraction.
 */
public record IntegerNode() implements ScalarNode {
	@Override
	public String briefIdentifier() {
		return "INTEGER";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitInteger(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
