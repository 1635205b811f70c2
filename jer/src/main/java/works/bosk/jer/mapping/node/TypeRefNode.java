package works.bosk.jer.mapping.node;

import works.bosk.jer.mapping.TypeName;

import static java.util.Objects.requireNonNull;

/**
 * Specifies only that the value has the named type {@code target},
 * whose node is held separately in a {@link works.bosk.jer.mapping.SchemaMap SchemaMap}.
 * <p>
 * This indirection is what allows recursive type definitions,
 * and lets types used in many places be compiled once.
 */
public record TypeRefNode(
	TypeName target
) implements TypeNode {
	public TypeRefNode {
		requireNonNull(target);
	}

	@Override
	public String briefIdentifier() {
		return target.typeName();
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitTypeRef(this, argument);
	}

	@Override
	public String toString() {
		return "@" + target;
	}
}
