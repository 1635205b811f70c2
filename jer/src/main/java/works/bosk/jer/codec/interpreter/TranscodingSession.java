package works.bosk.jer.codec.interpreter;

import java.util.ArrayDeque;
import java.util.Deque;
import works.bosk.jer.codec.CodecSettings;
import works.bosk.jer.exceptions.JerException;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.node.TypeNode;
import works.bosk.jer.mapping.node.TypeRefNode;

/**
 * State of a single encode or decode call: the location within the value,
 * for error messages, and the nesting depth, for {@link CodecSettings#maxDepth()}.
 * <p>
 * Sessions are confined to one thread and discarded when the call returns.
 */
abstract class TranscodingSession {
	final SchemaMap schemaMap;
	final CodecSettings settings;
	private final Deque<String> path = new ArrayDeque<>();

	TranscodingSession(SchemaMap schemaMap, CodecSettings settings) {
		this.schemaMap = schemaMap;
		this.settings = settings;
	}

	/**
	 * @return a failure of the appropriate type for this session's direction
	 */
	abstract JerException failure(String message);

	final void enter(String segment) {
		if (path.size() >= settings.maxDepth()) {
			throw failure("Nesting exceeds the maximum depth of " + settings.maxDepth() + " at " + location());
		}
		path.addLast(segment);
	}

	final void exit() {
		path.removeLast();
	}

	/**
	 * @return a slash-separated path of member names and array indexes
	 */
	final String location() {
		return path.isEmpty() ? "/" : "/" + String.join("/", path);
	}

	final TypeNode resolve(TypeRefNode node) {
		return schemaMap.get(node.target());
	}
}
