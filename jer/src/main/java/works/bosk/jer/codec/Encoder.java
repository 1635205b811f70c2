package works.bosk.jer.codec;

import tools.jackson.databind.JsonNode;

/**
 * Converts native values into the JSON tree of their wire form.
 */
public interface Encoder {
	/**
	 * @throws works.bosk.jer.exceptions.EncodeException if {@code value} doesn't fit the type
	 */
	JsonNode encode(Object value);
}
