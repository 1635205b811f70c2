package works.bosk.jer.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jer.codec.io.WireAdapter;
import works.bosk.jer.compiler.CompilerSettings;
import works.bosk.jer.compiler.SchemaCompiler;
import works.bosk.jer.descriptor.SchemaDescriptor;
import works.bosk.jer.exceptions.SchemaException;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.TypeName;

/**
 * Every type of a schema, compiled and ready to use,
 * organized by module name and then type name.
 * <p>
 * Immutable and thread-safe. Compile once and share.
 */
public final class CompiledSchema {
	private final SchemaMap schemaMap;
	private final Map<String, Map<String, CompiledType>> modules;

	private CompiledSchema(SchemaMap schemaMap, Map<String, Map<String, CompiledType>> modules) {
		this.schemaMap = schemaMap;
		this.modules = modules;
	}

	public static CompiledSchema compile(SchemaDescriptor schema) {
		return compile(schema, CompilerSettings.DEFAULT, CodecSettings.DEFAULT);
	}

	/**
	 * @throws SchemaException if a type fails to compile and {@code compilerSettings}
	 * doesn't quarantine failures
	 */
	public static CompiledSchema compile(SchemaDescriptor schema, CompilerSettings compilerSettings, CodecSettings codecSettings) {
		SchemaMap schemaMap = SchemaCompiler.compileSchema(schema, compilerSettings);
		Codec codec = CodecBuilder.using(schemaMap)
			.withSettings(codecSettings)
			.build();
		WireAdapter wire = new WireAdapter();
		Map<String, Map<String, CompiledType>> modules = new LinkedHashMap<>();
		schemaMap.forEach((name, node) -> modules
			.computeIfAbsent(name.moduleName(), m -> new LinkedHashMap<>())
			.put(name.typeName(), new CompiledType(name, node, codec, wire)));
		modules.replaceAll((m, types) -> Collections.unmodifiableMap(types));
		if (!schemaMap.quarantined().isEmpty()) {
			LOGGER.warn("{} type(s) could not be compiled: {}", schemaMap.quarantined().size(), schemaMap.quarantined().keySet());
		}
		return new CompiledSchema(schemaMap, Collections.unmodifiableMap(modules));
	}

	/**
	 * @throws IllegalArgumentException if there's no such compiled type
	 */
	public CompiledType type(String moduleName, String typeName) {
		Map<String, CompiledType> types = modules.get(moduleName);
		CompiledType result = (types == null) ? null : types.get(typeName);
		if (result == null) {
			TypeName name = new TypeName(moduleName, typeName);
			SchemaException failure = schemaMap.quarantined().get(name);
			if (failure == null) {
				throw new IllegalArgumentException("No such type: " + name);
			} else {
				throw new IllegalArgumentException("Type " + name + " failed to compile: " + failure.getMessage(), failure);
			}
		}
		return result;
	}

	/**
	 * @return module name → type name → compiled type
	 */
	public Map<String, Map<String, CompiledType>> modules() {
		return modules;
	}

	/**
	 * @return the types that were quarantined, with the reason for each.
	 * Always empty unless compiled with {@link CompilerSettings#quarantineFailures()}.
	 */
	public Map<TypeName, SchemaException> failures() {
		return schemaMap.quarantined();
	}

	public SchemaMap schemaMap() {
		return schemaMap;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompiledSchema.class);
}
