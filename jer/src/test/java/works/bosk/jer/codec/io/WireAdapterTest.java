package works.bosk.jer.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.bosk.jer.exceptions.MalformedWireException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WireAdapterTest {
	final WireAdapter wire = new WireAdapter();

	@Test
	void serialize_isCompact() {
		ObjectNode object = JsonNodeFactory.instance.objectNode();
		object.put("b", 1);
		object.put("a", "x y");
		object.putArray("list").add(true).add(2.5);
		assertEquals("{\"b\":1,\"a\":\"x y\",\"list\":[true,2.5]}", new String(wire.serialize(object), UTF_8));
	}

	@Test
	void serialize_isUtf8() {
		byte[] bytes = wire.serialize(JsonNodeFactory.instance.stringNode("é"));
		assertEquals(4, bytes.length);
		assertEquals((byte) 0xC3, bytes[1]);
		assertEquals((byte) 0xA9, bytes[2]);
	}

	@Test
	void deserialize() {
		JsonNode result = wire.deserialize(" { \"a\" : [ 1 , null ] } ".getBytes(UTF_8));
		assertTrue(result.isObject());
		assertEquals(2, result.get("a").size());
		assertTrue(result.get("a").get(1).isNull());
	}

	@Test
	void deserialize_scalarDocument() {
		assertEquals("héllo", wire.deserialize("\"héllo\"".getBytes(UTF_8)).stringValue());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"   ",
		"{",
		"{\"a\":}",
		"[1,]",
		"{\"a\":1} {\"b\":2}",
		"[1] x",
		"{'a':1}",
		"{\"a\":1,\"a\":2}",
		"tru",
	})
	void deserialize_invalidJson(String text) {
		assertThrows(MalformedWireException.class, () -> wire.deserialize(text.getBytes(UTF_8)));
	}

	@Test
	void deserialize_invalidUtf8() {
		byte[] bytes = { '"', (byte) 0xC3, '"' };
		assertThrows(MalformedWireException.class, () -> wire.deserialize(bytes));
		byte[] overlong = { '"', (byte) 0xC0, (byte) 0x80, '"' };
		assertThrows(MalformedWireException.class, () -> wire.deserialize(overlong));
	}
}
