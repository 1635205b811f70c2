package works.bosk.jer.codec.io;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.StreamReadFeature;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.bosk.jer.exceptions.EncodeException;
import works.bosk.jer.exceptions.MalformedWireException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Converts between the {@link JsonNode} tree and UTF-8 JSON text.
 * <p>
 * Output is compact: no whitespace between tokens, object members in insertion order.
 * Input must be exactly one well-formed JSON value in valid UTF-8;
 * anything else is a {@link MalformedWireException}.
 * <p>
 * Thread-safe.
 */
public final class WireAdapter {
	private final ObjectMapper mapper;

	public WireAdapter() {
		this.mapper = JsonMapper.builder()
			.enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.build();
	}

	public byte[] serialize(JsonNode value) {
		try {
			return mapper.writeValueAsBytes(value);
		} catch (JacksonException e) {
			throw new EncodeException("Unable to write JSON: " + e.getOriginalMessage(), e);
		}
	}

	public JsonNode deserialize(byte[] bytes) {
		String text = decodeUtf8(bytes);
		JsonNode result;
		try {
			result = mapper.readTree(text);
		} catch (JacksonException e) {
			throw new MalformedWireException("Invalid JSON: " + e.getOriginalMessage(), e);
		}
		if (result == null || result.isMissingNode()) {
			throw new MalformedWireException("No JSON value in input");
		}
		LOGGER.trace("Read {} bytes as {}", bytes.length, result.getNodeType());
		return result;
	}

	private static String decodeUtf8(byte[] bytes) {
		CharsetDecoder decoder = UTF_8.newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return decoder.decode(ByteBuffer.wrap(bytes)).toString();
		} catch (CharacterCodingException e) {
			throw new MalformedWireException("Invalid UTF-8: " + e.getMessage(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WireAdapter.class);
}
