package works.bosk.jer.exceptions;

/**
 * The input bytes are not valid UTF-8, or not valid JSON text.
 */
public final class MalformedWireException extends DecodeException {
	public MalformedWireException(String message) {
		super(message);
	}

	public MalformedWireException(String message, Throwable cause) {
		super(message, cause);
	}
}
