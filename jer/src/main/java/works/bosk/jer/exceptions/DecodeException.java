package works.bosk.jer.exceptions;

/**
 * The wire value does not match the type node it is being decoded with.
 */
public sealed class DecodeException extends JerException permits MalformedWireException {
	public DecodeException(String message) {
		super(message);
	}

	public DecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
