package works.bosk.jer.exceptions;

/**
 * Base of all failures reported by this library.
 * <p>
 * Errors are local to a single compile, encode or decode call,
 * and are never retried internally.
 */
public sealed abstract class JerException extends RuntimeException permits
	SchemaException,
	EncodeException,
	DecodeException
{
	protected JerException(String message) {
		super(message);
	}

	protected JerException(String message, Throwable cause) {
		super(message, cause);
	}
}
