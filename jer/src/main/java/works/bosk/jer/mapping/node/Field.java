package works.bosk.jer.mapping.node;

import works.bosk.jer.mapping.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A named member of a {@link MemberListNode}.
 * <p>
 * A field may be OPTIONAL, have a DEFAULT, both, or neither.
 * CHOICE alternatives are never optional and never have a default.
 *
 * @param defaultValue the DEFAULT value in native form, or null if there is none.
 *                     The field keeps its own deep copy.
 */
public record Field(
	String name,
	TypeNode node,
	boolean optional,
	@Nullable Object defaultValue
) {
	public Field {
		requireNonNull(name);
		requireNonNull(node);
		defaultValue = NativeCopies.deepCopy(defaultValue);
	}

	public static Field alternative(String name, TypeNode node) {
		return new Field(name, node, false, null);
	}

	/**
	 * @return a fresh deep copy of the DEFAULT value, which the caller may modify;
	 * or null if there is no default
	 */
	@Override
	public Object defaultValue() {
		return NativeCopies.deepCopy(defaultValue);
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	/**
	 * @return true if the field must be present in an encoded value
	 */
	public boolean isRequired() {
		return !optional && defaultValue == null;
	}

	@Override
	public String toString() {
		return name + " " + node
			+ (optional ? " OPTIONAL" : "")
			+ (defaultValue == null ? "" : " DEFAULT " + defaultValue);
	}
}
