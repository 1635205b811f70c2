package works.bosk.jer.mapping.node;

/**
 * REAL, represented as a JSON number, or one of the strings "NaN", "INF", "-INF" and "-0".
 */
public record RealNode() implements ScalarNode {
	public static final String NOT_A_NUMBER = "NaN";
	public static final String POSITIVE_INFINITY = "INF";
	public static final String NEGATIVE_INFINITY = "-INF";
	public static final String NEGATIVE_ZERO = "-0";

	@Override
	public String briefIdentifier() {
		return "REAL";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitReal(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
