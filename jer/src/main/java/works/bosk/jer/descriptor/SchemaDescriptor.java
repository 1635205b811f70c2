package works.bosk.jer.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The whole Descriptor Model: module name to {@link ModuleDescriptor}.
 * Immutable.
 */
public record SchemaDescriptor(
	Map<String, ModuleDescriptor> modules
) {
	public SchemaDescriptor {
		modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
	}

	/**
	 * @throws IllegalArgumentException if there's no such module
	 */
	public ModuleDescriptor module(String moduleName) {
		ModuleDescriptor result = modules.get(moduleName);
		if (result == null) {
			throw new IllegalArgumentException("No module named '" + moduleName + "'");
		}
		return result;
	}
}
