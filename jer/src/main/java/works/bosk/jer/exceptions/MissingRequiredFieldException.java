package works.bosk.jer.exceptions;

/**
 * A SEQUENCE or SET member that is neither OPTIONAL nor DEFAULT
 * is absent from the value being encoded.
 */
public final class MissingRequiredFieldException extends EncodeException {
	private final String memberName;

	public MissingRequiredFieldException(String memberName, String message) {
		super(message);
		this.memberName = memberName;
	}

	public String memberName() {
		return memberName;
	}
}
