package works.bosk.jer.compiler;

/**
 * @param quarantineFailures if false, the first type that fails to compile aborts
 *                           the whole schema; if true, that type and any type that
 *                           refers to it are left out, and the rest of the schema compiles
 */
public record CompilerSettings(
	boolean quarantineFailures
) {
	public static final CompilerSettings DEFAULT = new CompilerSettings(false);

	public static final CompilerSettings QUARANTINE = new CompilerSettings(true);

	public CompilerSettings withQuarantineFailures(boolean quarantineFailures) {
		return new CompilerSettings(quarantineFailures);
	}
}
