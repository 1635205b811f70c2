package works.bosk.jer.mapping.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ENUMERATED, represented as a JSON string holding the identifier.
 * <p>
 * Holds the ordinal/identifier bijection in both directions.
 * Use {@link #of} to derive one direction from the other.
 */
public record EnumeratedNode(
	Map<Long, String> namesByOrdinal,
	Map<String, Long> ordinalsByName
) implements ScalarNode {
	public EnumeratedNode {
		if (namesByOrdinal.size() != ordinalsByName.size()) {
			throw new IllegalArgumentException("Enumeration identifiers must be unique: " + namesByOrdinal.values());
		}
		namesByOrdinal = Collections.unmodifiableMap(new LinkedHashMap<>(namesByOrdinal));
		ordinalsByName = Collections.unmodifiableMap(new LinkedHashMap<>(ordinalsByName));
		for (Map.Entry<Long, String> entry : namesByOrdinal.entrySet()) {
			if (!entry.getKey().equals(ordinalsByName.get(entry.getValue()))) {
				throw new IllegalArgumentException("Inconsistent enumeration entry " + entry.getValue() + "(" + entry.getKey() + ")");
			}
		}
	}

	public static EnumeratedNode of(Map<Long, String> namesByOrdinal) {
		var ordinalsByName = new LinkedHashMap<String, Long>();
		namesByOrdinal.forEach((ordinal, name) -> ordinalsByName.put(name, ordinal));
		return new EnumeratedNode(namesByOrdinal, ordinalsByName);
	}

	public boolean hasName(String name) {
		return ordinalsByName.containsKey(name);
	}

	public Optional<Long> ordinalOf(String name) {
		return Optional.ofNullable(ordinalsByName.get(name));
	}

	public Optional<String> nameOf(long ordinal) {
		return Optional.ofNullable(namesByOrdinal.get(ordinal));
	}

	/**
	 * @return the identifiers in declaration order
	 */
	public List<String> names() {
		return List.copyOf(namesByOrdinal.values());
	}

	@Override
	public String briefIdentifier() {
		return "ENUMERATED";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitEnumerated(this, argument);
	}

	@Override
	public String toString() {
		return "ENUMERATED" + names();
	}
}
