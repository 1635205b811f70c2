package works.bosk.jer.codec;

import tools.jackson.databind.JsonNode;
import works.bosk.jer.codec.io.WireAdapter;
import works.bosk.jer.mapping.TypeName;
import works.bosk.jer.mapping.node.TypeNode;

import static java.util.Objects.requireNonNull;

/**
 * One named type, ready to convert native values to and from JER bytes.
 * <p>
 * Immutable and thread-safe.
 */
public final class CompiledType {
	private final TypeName name;
	private final TypeNode node;
	private final Encoder encoder;
	private final Decoder decoder;
	private final WireAdapter wire;

	CompiledType(TypeName name, TypeNode node, Codec codec, WireAdapter wire) {
		this.name = requireNonNull(name);
		this.node = requireNonNull(node);
		this.encoder = codec.encoderFor(node);
		this.decoder = codec.decoderFor(node);
		this.wire = requireNonNull(wire);
	}

	/**
	 * @return compact UTF-8 JSON text
	 * @throws works.bosk.jer.exceptions.EncodeException if {@code value} doesn't fit this type
	 */
	public byte[] encode(Object value) {
		return wire.serialize(encoder.encode(value));
	}

	/**
	 * @throws works.bosk.jer.exceptions.MalformedWireException if {@code bytes} isn't UTF-8 JSON text
	 * @throws works.bosk.jer.exceptions.DecodeException if the JSON doesn't fit this type
	 */
	public Object decode(byte[] bytes) {
		return decoder.decode(wire.deserialize(bytes));
	}

	public JsonNode encodeTree(Object value) {
		return encoder.encode(value);
	}

	public Object decodeTree(JsonNode tree) {
		return decoder.decode(tree);
	}

	public TypeName name() {
		return name;
	}

	public TypeNode node() {
		return node;
	}

	@Override
	public String toString() {
		return name + " ::= " + node;
	}
}
