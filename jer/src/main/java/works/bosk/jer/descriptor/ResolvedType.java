package works.bosk.jer.descriptor;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of resolving a named-type reference.
 *
 * @param moduleName the module that actually defines the type,
 *                   which differs from the referring module when the name is imported
 */
public record ResolvedType(
	TypeDescriptor descriptor,
	String moduleName
) {
	public ResolvedType {
		requireNonNull(descriptor);
		requireNonNull(moduleName);
	}
}
