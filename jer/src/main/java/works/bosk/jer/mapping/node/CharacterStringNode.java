package works.bosk.jer.mapping.node;

import static java.util.Objects.requireNonNull;

/**
 * Any of the {@link CharacterStringType}s, represented as a JSON string
 * whose content is the value, unchanged.
 */
public record CharacterStringNode(
	CharacterStringType type
) implements ScalarNode {
	public CharacterStringNode {
		requireNonNull(type);
	}

	@Override
	public String briefIdentifier() {
		return type.kind().keyword();
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitCharacterString(this, argument);
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
