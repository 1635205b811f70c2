package works.bosk.jer.codec;

import tools.jackson.databind.JsonNode;

/**
 * Reconstructs native values from the JSON tree of their wire form.
 */
public interface Decoder {
	/**
	 * @throws works.bosk.jer.exceptions.DecodeException if {@code wire} doesn't fit the type
	 */
	Object decode(JsonNode wire);
}
