package works.bosk.jer.descriptor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * The ASN.1 keywords that a {@link TypeDescriptor#kind() kind} can name.
 * Any other kind string is a reference to a named type.
 */
public enum BuiltinKind {
	INTEGER("INTEGER"),
	REAL("REAL"),
	BOOLEAN("BOOLEAN"),
	NULL("NULL"),
	ENUMERATED("ENUMERATED"),
	IA5_STRING("IA5String"),
	NUMERIC_STRING("NumericString"),
	PRINTABLE_STRING("PrintableString"),
	UNIVERSAL_STRING("UniversalString"),
	VISIBLE_STRING("VisibleString"),
	UTF8_STRING("UTF8String"),
	BMP_STRING("BMPString"),
	TELETEX_STRING("TeletexString"),
	UTC_TIME("UTCTime"),
	GENERALIZED_TIME("GeneralizedTime"),
	BIT_STRING("BIT STRING"),
	OCTET_STRING("OCTET STRING"),
	OBJECT_IDENTIFIER("OBJECT IDENTIFIER"),
	SEQUENCE("SEQUENCE"),
	SET("SET"),
	SEQUENCE_OF("SEQUENCE OF"),
	SET_OF("SET OF"),
	CHOICE("CHOICE"),
	ANY("ANY"),
	ANY_DEFINED_BY("ANY DEFINED BY");

	private final String keyword;

	BuiltinKind(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	/**
	 * @return the kind with the given keyword, or empty if {@code keyword}
	 * names something else, such as a user-defined type
	 */
	public static Optional<BuiltinKind> forKeyword(String keyword) {
		return Optional.ofNullable(BY_KEYWORD.get(keyword));
	}

	private static final Map<String, BuiltinKind> BY_KEYWORD = Arrays.stream(values())
		.collect(toUnmodifiableMap(BuiltinKind::keyword, identity()));
}
