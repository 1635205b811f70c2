package works.bosk.jer.exceptions;

/**
 * A type descriptor could not be compiled into a type node.
 * <p>
 * Aborts compilation of the offending type.
 * This class is concrete so it can describe schema problems
 * that have no more specific subclass, such as circular type aliases.
 */
public sealed class SchemaException extends JerException permits
	UnresolvedTypeException,
	UnsupportedExtensionException
{
	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
