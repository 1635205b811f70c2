package works.bosk.jer.exceptions;

/**
 * A native value does not fit the type node it is being encoded with.
 */
public sealed class EncodeException extends JerException permits MissingRequiredFieldException {
	public EncodeException(String message) {
		super(message);
	}

	public EncodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
