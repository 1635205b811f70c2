package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.BuiltinKind;

/**
 * The ASN.1 types whose values are text.
 * They all share the same JSON representation;
 * the distinction is kept so a compiled node still says which type it came from.
 */
public enum CharacterStringType {
	IA5_STRING(BuiltinKind.IA5_STRING),
	NUMERIC_STRING(BuiltinKind.NUMERIC_STRING),
	PRINTABLE_STRING(BuiltinKind.PRINTABLE_STRING),
	UNIVERSAL_STRING(BuiltinKind.UNIVERSAL_STRING),
	VISIBLE_STRING(BuiltinKind.VISIBLE_STRING),
	UTF8_STRING(BuiltinKind.UTF8_STRING),
	BMP_STRING(BuiltinKind.BMP_STRING),
	TELETEX_STRING(BuiltinKind.TELETEX_STRING),
	UTC_TIME(BuiltinKind.UTC_TIME),
	GENERALIZED_TIME(BuiltinKind.GENERALIZED_TIME);

	private final BuiltinKind kind;

	CharacterStringType(BuiltinKind kind) {
		this.kind = kind;
	}

	public BuiltinKind kind() {
		return kind;
	}

	public boolean isTime() {
		return this == UTC_TIME || this == GENERALIZED_TIME;
	}

	/**
	 * @throws IllegalArgumentException if {@code kind} is not a character string or time type
	 */
	public static CharacterStringType of(BuiltinKind kind) {
		for (CharacterStringType candidate : values()) {
			if (candidate.kind == kind) {
				return candidate;
			}
		}
		throw new IllegalArgumentException("Not a character string type: " + kind);
	}
}
