package works.bosk.jer.descriptor;

import works.bosk.jer.exceptions.UnresolvedTypeException;

/**
 * Finds the descriptor for a type name as seen from a given module.
 */
@FunctionalInterface
public interface TypeResolver {
	/**
	 * @throws UnresolvedTypeException if {@code typeName} is not visible from {@code moduleName}
	 */
	ResolvedType resolve(String typeName, String moduleName);
}
