package works.bosk.jer.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The types defined by one ASN.1 module, and the names it imports.
 *
 * @param types type name to descriptor, in declaration order
 * @param imports source module name to the type names imported from it
 */
public record ModuleDescriptor(
	Map<String, TypeDescriptor> types,
	Map<String, List<String>> imports
) {
	public ModuleDescriptor {
		types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		var copiedImports = new LinkedHashMap<String, List<String>>();
		imports.forEach((module, names) -> copiedImports.put(module, List.copyOf(names)));
		imports = Collections.unmodifiableMap(copiedImports);
	}

	public static ModuleDescriptor of(Map<String, TypeDescriptor> types) {
		return new ModuleDescriptor(types, Map.of());
	}
}
