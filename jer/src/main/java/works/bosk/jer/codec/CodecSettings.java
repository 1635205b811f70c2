package works.bosk.jer.codec;

/**
 * Policies for the structural transcoder.
 *
 * @param defaultElision what to do when encoding a member whose value equals its DEFAULT
 * @param absentMemberPolicy what to do when decoding a SEQUENCE or SET that lacks a required member
 * @param maxDepth the deepest nesting a single encode or decode may reach,
 *                 so that values of recursive types fail cleanly instead of exhausting the stack
 */
public record CodecSettings(
	DefaultElision defaultElision,
	AbsentMemberPolicy absentMemberPolicy,
	int maxDepth
) {
	public CodecSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public static final CodecSettings DEFAULT = new CodecSettings(
		DefaultElision.OMIT_WHEN_EQUAL,
		AbsentMemberPolicy.LENIENT,
		512);

	public enum DefaultElision {
		/**
		 * A member equal to its DEFAULT is left out of the JSON object.
		 */
		OMIT_WHEN_EQUAL,

		/**
		 * A member present in the native value is always written.
		 */
		EMIT_WHEN_PRESENT,
	}

	public enum AbsentMemberPolicy {
		/**
		 * A missing required member is left out of the decoded value.
		 */
		LENIENT,

		/**
		 * A missing required member is a {@link works.bosk.jer.exceptions.DecodeException DecodeException}.
		 */
		STRICT,
	}

	public CodecSettings withDefaultElision(DefaultElision defaultElision) {
		return new CodecSettings(defaultElision, absentMemberPolicy, maxDepth);
	}

	public CodecSettings withAbsentMemberPolicy(AbsentMemberPolicy absentMemberPolicy) {
		return new CodecSettings(defaultElision, absentMemberPolicy, maxDepth);
	}

	public CodecSettings withMaxDepth(int maxDepth) {
		return new CodecSettings(defaultElision, absentMemberPolicy, maxDepth);
	}
}
