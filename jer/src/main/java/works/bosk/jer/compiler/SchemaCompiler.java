package works.bosk.jer.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jer.descriptor.BuiltinKind;
import works.bosk.jer.descriptor.ImportingTypeResolver;
import works.bosk.jer.descriptor.ResolvedType;
import works.bosk.jer.descriptor.SchemaDescriptor;
import works.bosk.jer.descriptor.SizeConstraintExtractor;
import works.bosk.jer.descriptor.TypeDescriptor;
import works.bosk.jer.descriptor.TypeResolver;
import works.bosk.jer.exceptions.SchemaException;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.TypeName;
import works.bosk.jer.mapping.node.AnyNode;
import works.bosk.jer.mapping.node.BitStringNode;
import works.bosk.jer.mapping.node.BooleanNode;
import works.bosk.jer.mapping.node.CharacterStringNode;
import works.bosk.jer.mapping.node.CharacterStringType;
import works.bosk.jer.mapping.node.ChoiceNode;
import works.bosk.jer.mapping.node.EnumeratedNode;
import works.bosk.jer.mapping.node.IntegerNode;
import works.bosk.jer.mapping.node.NullNode;
import works.bosk.jer.mapping.node.ObjectIdentifierNode;
import works.bosk.jer.mapping.node.OctetStringNode;
import works.bosk.jer.mapping.node.RealNode;
import works.bosk.jer.mapping.node.SequenceNode;
import works.bosk.jer.mapping.node.SequenceOfNode;
import works.bosk.jer.mapping.node.SetNode;
import works.bosk.jer.mapping.node.SetOfNode;
import works.bosk.jer.mapping.node.TypeNode;
import works.bosk.jer.mapping.node.TypeRefNode;

import static java.util.Objects.requireNonNull;

/**
 * Builds {@link TypeNode} trees from {@link TypeDescriptor}s
 * and collects them in a {@link SchemaMap}.
 * <p>
 * Every named type is compiled at most once. A reference to a named type compiles
 * to a {@link TypeRefNode}, and the referenced type is compiled into the
 * {@link SchemaMap} first unless it is already there or is still being compiled.
 * That is what lets self-referential and mutually recursive definitions terminate.
 * <p>
 * Not thread-safe. Use one compiler per schema, then call {@link #finish}.
 */
public class SchemaCompiler {
	private final TypeResolver resolver;
	private final SizeConstraintExtractor sizes;
	private final CompilerSettings settings;
	private final MemberCompiler memberCompiler = new MemberCompiler(this);
	private final SchemaMap schemaMap = new SchemaMap();
	private final Set<TypeName> inProgress = new HashSet<>();
	private final Map<TypeName, SchemaException> failed = new HashMap<>();
	private final Map<TypeName, TypeName> resolvedReferences = new HashMap<>();

	public SchemaCompiler(TypeResolver resolver, SizeConstraintExtractor sizes, CompilerSettings settings) {
		this.resolver = requireNonNull(resolver);
		this.sizes = requireNonNull(sizes);
		this.settings = requireNonNull(settings);
	}

	public static SchemaMap compileSchema(SchemaDescriptor schema) {
		return compileSchema(schema, CompilerSettings.DEFAULT);
	}

	/**
	 * Compiles every type of every module in {@code schema},
	 * resolving references with an {@link ImportingTypeResolver}
	 * and sizes with {@link SizeConstraintExtractor#declared()}.
	 *
	 * @return the frozen {@link SchemaMap}
	 * @throws SchemaException if a type fails to compile and {@code settings} doesn't quarantine failures
	 */
	public static SchemaMap compileSchema(SchemaDescriptor schema, CompilerSettings settings) {
		var compiler = new SchemaCompiler(
			new ImportingTypeResolver(schema),
			SizeConstraintExtractor.declared(),
			settings);
		LOGGER.debug("Compiling modules {} with {}", schema.modules().keySet(), settings);
		schema.modules().forEach((moduleName, module) ->
			module.types().forEach((typeName, descriptor) ->
				compiler.compileTopLevel(moduleName, typeName, descriptor)));
		return compiler.finish();
	}

	/**
	 * Compiles one named type, along with any named types it refers to
	 * that haven't been compiled yet.
	 *
	 * @return the node for the named type
	 * @throws SchemaException if the type, or a type it refers to, can't be compiled
	 */
	public TypeNode compile(String moduleName, String typeName, TypeDescriptor descriptor) {
		TypeName name = new TypeName(moduleName, typeName);
		compileNamed(name, descriptor);
		return schemaMap.get(name);
	}

	/**
	 * Freezes and returns the {@link SchemaMap}.
	 * When quarantining failures, first removes any type whose tree still
	 * refers to a type that failed.
	 */
	public SchemaMap finish() {
		if (settings.quarantineFailures()) {
			quarantineDanglingReferences();
		}
		schemaMap.freeze();
		LOGGER.debug("Compiled schema: {}", schemaMap.knownTypes());
		return schemaMap;
	}

	private void compileTopLevel(String moduleName, String typeName, TypeDescriptor descriptor) {
		if (!settings.quarantineFailures()) {
			compile(moduleName, typeName, descriptor);
			return;
		}
		try {
			compile(moduleName, typeName, descriptor);
		} catch (SchemaException e) {
			TypeName name = new TypeName(moduleName, typeName);
			LOGGER.warn("Quarantining type {}: {}", name, e.getMessage());
			schemaMap.quarantine(name, e);
		}
	}

	private void compileNamed(TypeName name, TypeDescriptor descriptor) {
		if (schemaMap.contains(name) || inProgress.contains(name)) {
			return;
		}
		SchemaException previousFailure = failed.get(name);
		if (previousFailure != null) {
			throw new SchemaException("Type " + name + " failed to compile: " + previousFailure.getMessage(), previousFailure);
		}
		LOGGER.debug("Compiling {}", name);
		inProgress.add(name);
		try {
			TypeNode node = compileType(descriptor, name.moduleName());
			checkAliasChain(name, node);
			schemaMap.put(name, node);
			LOGGER.trace("Compiled {} as {}", name, node);
		} catch (IllegalArgumentException e) {
			SchemaException wrapped = new SchemaException("Invalid definition of " + name + ": " + e.getMessage(), e);
			failed.put(name, wrapped);
			throw wrapped;
		} catch (SchemaException e) {
			failed.put(name, e);
			throw e;
		} finally {
			inProgress.remove(name);
		}
	}

	/**
	 * The recursive descent over one descriptor.
	 * Package-private for {@link MemberCompiler}.
	 */
	TypeNode compileType(TypeDescriptor descriptor, String moduleName) {
		Optional<BuiltinKind> builtin = descriptor.builtinKind();
		if (builtin.isEmpty()) {
			return compileReference(descriptor.kind(), moduleName);
		}
		BuiltinKind kind = builtin.get();
		return switch (kind) {
			case INTEGER -> new IntegerNode();
			case REAL -> new RealNode();
			case BOOLEAN -> new BooleanNode();
			case NULL -> new NullNode();
			case ENUMERATED -> EnumeratedNode.of(descriptor.values());
			case IA5_STRING, NUMERIC_STRING, PRINTABLE_STRING, UNIVERSAL_STRING, VISIBLE_STRING,
				UTF8_STRING, BMP_STRING, TELETEX_STRING, UTC_TIME, GENERALIZED_TIME ->
				new CharacterStringNode(CharacterStringType.of(kind));
			case BIT_STRING -> new BitStringNode(sizes.sizeRange(descriptor, moduleName));
			case OCTET_STRING -> new OctetStringNode(sizes.sizeRange(descriptor, moduleName));
			case OBJECT_IDENTIFIER -> new ObjectIdentifierNode();
			case SEQUENCE -> {
				var members = memberCompiler.compileMembers(descriptor.members(), moduleName);
				yield new SequenceNode(members.fields(), members.extensible());
			}
			case SET -> {
				var members = memberCompiler.compileMembers(descriptor.members(), moduleName);
				yield new SetNode(members.fields(), members.extensible());
			}
			case CHOICE -> {
				var alternatives = memberCompiler.compileAlternatives(descriptor.members(), moduleName);
				yield new ChoiceNode(alternatives.fields(), alternatives.extensible());
			}
			case SEQUENCE_OF -> new SequenceOfNode(
				compileType(elementOf(descriptor), moduleName),
				sizes.sizeRange(descriptor, moduleName));
			case SET_OF -> new SetOfNode(
				compileType(elementOf(descriptor), moduleName),
				sizes.sizeRange(descriptor, moduleName));
			case ANY, ANY_DEFINED_BY -> new AnyNode();
		};
	}

	private TypeNode compileReference(String typeName, String moduleName) {
		TypeName key = new TypeName(moduleName, typeName);
		TypeName target = resolvedReferences.get(key);
		if (target == null) {
			ResolvedType resolved = resolver.resolve(typeName, moduleName);
			target = new TypeName(resolved.moduleName(), typeName);
			LOGGER.trace("Resolved {} to {}", key, target);
			compileNamed(target, resolved.descriptor());
			resolvedReferences.put(key, target);
		}
		return new TypeRefNode(target);
	}

	private static TypeDescriptor elementOf(TypeDescriptor descriptor) {
		if (descriptor.element() == null) {
			throw new SchemaException(descriptor.kind() + " has no element type");
		}
		return descriptor.element();
	}

	/**
	 * A type defined purely as another type, through any number of aliases,
	 * must eventually reach a type that isn't an alias.
	 */
	private void checkAliasChain(TypeName name, TypeNode node) {
		Set<TypeName> seen = new LinkedHashSet<>();
		seen.add(name);
		TypeNode current = node;
		while (current instanceof TypeRefNode ref) {
			if (!seen.add(ref.target())) {
				throw new SchemaException("Circular type alias: " + seen + " -> " + ref.target());
			}
			current = schemaMap.find(ref.target()).orElse(null);
		}
	}

	private void quarantineDanglingReferences() {
		boolean changed;
		do {
			changed = false;
			for (TypeName name : new ArrayList<>(schemaMap.knownTypes())) {
				Set<TypeName> references = new LinkedHashSet<>();
				schemaMap.get(name).accept(ReferenceCollector.INSTANCE, references);
				for (TypeName target : references) {
					if (!schemaMap.contains(target)) {
						LOGGER.warn("Quarantining type {} because it refers to {}", name, target);
						schemaMap.quarantine(name, new SchemaException("Type " + name + " refers to quarantined type " + target));
						changed = true;
						break;
					}
				}
			}
		} while (changed);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaCompiler.class);
}
