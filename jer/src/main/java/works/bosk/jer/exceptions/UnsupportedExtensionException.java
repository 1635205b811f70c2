package works.bosk.jer.exceptions;

/**
 * Members were declared after an extension marker.
 * Extension addition groups are not supported.
 */
public final class UnsupportedExtensionException extends SchemaException {
	private final String memberName;

	public UnsupportedExtensionException(String memberName) {
		super("Extension additions are not supported; found member '" + memberName + "' after the extension marker");
		this.memberName = memberName;
	}

	public String memberName() {
		return memberName;
	}
}
