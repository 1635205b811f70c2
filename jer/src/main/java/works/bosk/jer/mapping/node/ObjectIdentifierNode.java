package works.bosk.jer.mapping.node;

import java.util.regex.Pattern;

/**
 * OBJECT IDENTIFIER, represented as a JSON string in dotted-decimal form,
 * like {@code "1.2.840.113549"}.
 */
public record ObjectIdentifierNode() implements ScalarNode {
	/**
	 * @return true if {@code text} has at least two arcs, each a non-negative decimal
	 * number without redundant leading zeros
	 */
	public static boolean isValid(CharSequence text) {
		return DOTTED_DECIMAL.matcher(text).matches();
	}

	@Override
	public String briefIdentifier() {
		return "OBJECT IDENTIFIER";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitObjectIdentifier(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}

	private static final Pattern DOTTED_DECIMAL = Pattern.compile("(0|[1-9][0-9]*)(\\.(0|[1-9][0-9]*))+");
}
