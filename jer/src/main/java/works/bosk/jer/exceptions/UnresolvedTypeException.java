package works.bosk.jer.exceptions;

/**
 * A named-type reference could not be found in the referring module or its imports.
 */
public final class UnresolvedTypeException extends SchemaException {
	private final String typeName;
	private final String moduleName;

	public UnresolvedTypeException(String typeName, String moduleName) {
		super("Type '" + typeName + "' not found in module '" + moduleName + "' or its imports");
		this.typeName = typeName;
		this.moduleName = moduleName;
	}

	public String typeName() {
		return typeName;
	}

	public String moduleName() {
		return moduleName;
	}
}
