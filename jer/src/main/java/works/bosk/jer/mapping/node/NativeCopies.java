package works.bosk.jer.mapping.node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import tools.jackson.databind.JsonNode;

/**
 * Deep copies of native values, so that a value held by a compiled node
 * never shares mutable state with a caller.
 * <p>
 * Arrays, collections and JSON trees are copied; everything else in the
 * native value model is immutable and is returned as-is.
 */
final class NativeCopies {
	private NativeCopies() { }

	static Object deepCopy(Object value) {
		if (value instanceof byte[] bytes) {
			return bytes.clone();
		} else if (value instanceof JsonNode json) {
			return json.deepCopy();
		} else if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(k, deepCopy(v)));
			return result;
		} else if (value instanceof Set<?> set) {
			Set<Object> result = new LinkedHashSet<>();
			for (Object element : set) {
				result.add(deepCopy(element));
			}
			return result;
		} else if (value instanceof Iterable<?> iterable) {
			List<Object> result = new ArrayList<>();
			for (Object element : iterable) {
				result.add(deepCopy(element));
			}
			return result;
		} else {
			return value;
		}
	}
}
