package works.bosk.jer.mapping.node;

/**
 * ANY and ANY DEFINED BY: an open type whose value is arbitrary JSON,
 * carried through unchanged as a {@link tools.jackson.databind.JsonNode JsonNode}.
 */
public record AnyNode() implements TypeNode {
	@Override
	public String briefIdentifier() {
		return "ANY";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitAny(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
