package works.bosk.jer.mapping;

import static java.util.Objects.requireNonNull;

/**
 * Identifies a named type: the key under which its compiled node
 * is stored in a {@link SchemaMap}.
 */
public record TypeName(
	String moduleName,
	String typeName
) {
	public TypeName {
		requireNonNull(moduleName);
		requireNonNull(typeName);
	}

	@Override
	public String toString() {
		return moduleName + "." + typeName;
	}
}
