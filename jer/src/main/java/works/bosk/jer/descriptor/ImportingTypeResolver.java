package works.bosk.jer.descriptor;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jer.exceptions.UnresolvedTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Resolves type names against a {@link SchemaDescriptor}:
 * first among the referring module's own types, then among the names
 * it imports, following re-exported imports transitively.
 */
public final class ImportingTypeResolver implements TypeResolver {
	private final SchemaDescriptor schema;

	public ImportingTypeResolver(SchemaDescriptor schema) {
		this.schema = requireNonNull(schema);
	}

	@Override
	public ResolvedType resolve(String typeName, String moduleName) {
		ResolvedType result = resolve(typeName, moduleName, new HashSet<>());
		if (result == null) {
			throw new UnresolvedTypeException(typeName, moduleName);
		}
		return result;
	}

	private ResolvedType resolve(String typeName, String moduleName, Set<String> visitedModules) {
		if (!visitedModules.add(moduleName)) {
			LOGGER.debug("Import cycle through module {} while resolving {}", moduleName, typeName);
			return null;
		}
		ModuleDescriptor module = schema.modules().get(moduleName);
		if (module == null) {
			return null;
		}
		TypeDescriptor local = module.types().get(typeName);
		if (local != null) {
			return new ResolvedType(local, moduleName);
		}
		for (Map.Entry<String, List<String>> entry : module.imports().entrySet()) {
			if (entry.getValue().contains(typeName)) {
				LOGGER.trace("{} imports {} from {}", moduleName, typeName, entry.getKey());
				ResolvedType imported = resolve(typeName, entry.getKey(), visitedModules);
				if (imported != null) {
					return imported;
				}
			}
		}
		return null;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ImportingTypeResolver.class);
}
