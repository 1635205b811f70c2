package works.bosk.jer.descriptor;

import works.bosk.jer.mapping.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One member of a SEQUENCE, SET or CHOICE.
 * <p>
 * A member named {@value #EXTENSION_MARKER_NAME} is not a field:
 * it marks the start of the extension additions, and has no descriptor.
 *
 * @param defaultValue the DEFAULT value, in native form, or null if there is none
 */
public record MemberDescriptor(
	String name,
	@Nullable TypeDescriptor descriptor,
	boolean optional,
	@Nullable Object defaultValue
) {
	public static final String EXTENSION_MARKER_NAME = "...";

	public MemberDescriptor {
		requireNonNull(name);
		if (descriptor == null && !EXTENSION_MARKER_NAME.equals(name)) {
			throw new IllegalArgumentException("Member '" + name + "' has no descriptor");
		}
	}

	public static MemberDescriptor required(String name, TypeDescriptor descriptor) {
		return new MemberDescriptor(name, requireNonNull(descriptor), false, null);
	}

	public static MemberDescriptor optional(String name, TypeDescriptor descriptor) {
		return new MemberDescriptor(name, requireNonNull(descriptor), true, null);
	}

	public static MemberDescriptor withDefault(String name, TypeDescriptor descriptor, Object defaultValue) {
		return new MemberDescriptor(name, requireNonNull(descriptor), false, requireNonNull(defaultValue));
	}

	/**
	 * A member both OPTIONAL and with a DEFAULT. When absent from the JSON,
	 * it is absent from the decoded value too; OPTIONAL takes precedence.
	 */
	public static MemberDescriptor optionalWithDefault(String name, TypeDescriptor descriptor, Object defaultValue) {
		return new MemberDescriptor(name, requireNonNull(descriptor), true, requireNonNull(defaultValue));
	}

	public static MemberDescriptor extensionMarker() {
		return EXTENSION_MARKER;
	}

	public boolean isExtensionMarker() {
		return EXTENSION_MARKER_NAME.equals(name);
	}

	private static final MemberDescriptor EXTENSION_MARKER =
		new MemberDescriptor(EXTENSION_MARKER_NAME, null, false, null);
}
