package works.bosk.jer.descriptor;

/**
 * Computes the numeric size bounds of a string or collection type.
 * <p>
 * The JSON mapping doesn't depend on sizes, but they are retained on the
 * compiled nodes for backends that do.
 */
@FunctionalInterface
public interface SizeConstraintExtractor {
	SizeRange sizeRange(TypeDescriptor descriptor, String moduleName);

	/**
	 * @return an extractor that reports the {@link TypeDescriptor#size() size}
	 * carried by the descriptor itself, or {@link SizeRange#UNCONSTRAINED} if none
	 */
	static SizeConstraintExtractor declared() {
		return (descriptor, moduleName) -> descriptor.size() == null
			? SizeRange.UNCONSTRAINED
			: descriptor.size();
	}
}
