package works.bosk.jer.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import works.bosk.jer.exceptions.SchemaException;
import works.bosk.jer.mapping.node.TypeNode;
import works.bosk.jer.mapping.node.TypeRefNode;

import static java.util.Objects.requireNonNull;

/**
 * The arena of compiled type nodes, addressed by {@link TypeName}.
 * Produced by the {@link works.bosk.jer.compiler.SchemaCompiler SchemaCompiler};
 * once {@link #freeze frozen}, can be considered immutable and shared freely between threads.
 * <p>
 * A {@link TypeRefNode} anywhere in a node tree is resolved by looking up its target here,
 * which is how recursive and shared type definitions are represented without copying.
 * <p>
 * Types that failed to compile while the compiler was quarantining failures
 * are recorded separately and have no node.
 */
public class SchemaMap {
	private final Map<TypeName, TypeNode> nodes = new LinkedHashMap<>();
	private final Map<TypeName, SchemaException> quarantined = new LinkedHashMap<>();
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	public void freeze() {
		isFrozen.set(true);
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	/**
	 * @throws IllegalArgumentException if there's no node for the given name
	 */
	public TypeNode get(TypeName name) {
		var result = nodes.get(name);
		if (result == null) {
			throw new IllegalArgumentException("No node for type " + name);
		}
		return result;
	}

	public Optional<TypeNode> find(TypeName name) {
		return Optional.ofNullable(nodes.get(name));
	}

	public boolean contains(TypeName name) {
		return nodes.containsKey(name);
	}

	public TypeNode put(TypeName name, TypeNode node) {
		checkNotFrozen();
		if (node instanceof TypeRefNode ref && ref.target().equals(name)) {
			throw new SchemaException("Type " + name + " is defined as itself");
		}
		return nodes.put(name, requireNonNull(node));
	}

	public void quarantine(TypeName name, SchemaException reason) {
		checkNotFrozen();
		nodes.remove(name);
		quarantined.put(name, requireNonNull(reason));
	}

	public Map<TypeName, SchemaException> quarantined() {
		return Collections.unmodifiableMap(quarantined);
	}

	public Set<TypeName> knownTypes() {
		return Collections.unmodifiableSet(nodes.keySet());
	}

	public void forEach(BiConsumer<TypeName, TypeNode> action) {
		nodes.forEach(action);
	}

	private void checkNotFrozen() {
		if (isFrozen.get()) {
			throw new IllegalStateException("SchemaMap is frozen");
		}
	}
}
