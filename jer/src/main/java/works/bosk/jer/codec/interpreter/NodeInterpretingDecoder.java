package works.bosk.jer.codec.interpreter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.bosk.jer.BitString;
import works.bosk.jer.codec.CodecSettings;
import works.bosk.jer.codec.Decoder;
import works.bosk.jer.exceptions.DecodeException;
import works.bosk.jer.exceptions.JerException;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.node.AnyNode;
import works.bosk.jer.mapping.node.BitStringNode;
import works.bosk.jer.mapping.node.BooleanNode;
import works.bosk.jer.mapping.node.CharacterStringNode;
import works.bosk.jer.mapping.node.ChoiceNode;
import works.bosk.jer.mapping.node.CollectionNode;
import works.bosk.jer.mapping.node.EnumeratedNode;
import works.bosk.jer.mapping.node.Field;
import works.bosk.jer.mapping.node.IntegerNode;
import works.bosk.jer.mapping.node.MemberListNode;
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
import static works.bosk.jer.codec.CodecSettings.AbsentMemberPolicy.STRICT;

/**
 * Walks a {@link TypeNode} tree alongside a {@link JsonNode}, building the
 * corresponding native value.
 * <p>
 * Members of a JSON object that the type doesn't declare are ignored,
 * which is how values from a later version of an extensible type are read.
 * An absent OPTIONAL member stays absent, even if it also has a DEFAULT;
 * otherwise an absent DEFAULT member decodes as a fresh copy of its default value.
 * <p>
 * Thread-safe: each call to {@link #decode} gets its own {@link Session}.
 */
public final class NodeInterpretingDecoder implements Decoder {
	private final TypeNode node;
	private final SchemaMap schemaMap;
	private final CodecSettings settings;

	public NodeInterpretingDecoder(TypeNode node, SchemaMap schemaMap, CodecSettings settings) {
		this.node = requireNonNull(node);
		this.schemaMap = requireNonNull(schemaMap);
		this.settings = requireNonNull(settings);
	}

	@Override
	public Object decode(JsonNode wire) {
		requireNonNull(wire);
		LOGGER.debug("Decoding {} as {}", wire.getNodeType(), node.briefIdentifier());
		return node.accept(new Session(schemaMap, settings), wire);
	}

	private static final class Session extends TranscodingSession implements TypeNode.Visitor<JsonNode, Object> {
		Session(SchemaMap schemaMap, CodecSettings settings) {
			super(schemaMap, settings);
		}

		@Override
		JerException failure(String message) {
			return new DecodeException(message);
		}

		@Override
		public Object visitInteger(IntegerNode node, JsonNode wire) {
			if (!wire.isIntegralNumber()) {
				throw wrongWire(node, "an integer", wire);
			}
			BigInteger value = wire.bigIntegerValue();
			if (value.bitLength() < Long.SIZE) {
				return value.longValue();
			} else {
				return value;
			}
		}

		@Override
		public Object visitReal(RealNode node, JsonNode wire) {
			if (wire.isNumber()) {
				return wire.doubleValue();
			} else if (wire.isString()) {
				String text = wire.stringValue();
				switch (text) {
					case RealNode.NOT_A_NUMBER:
						return Double.NaN;
					case RealNode.POSITIVE_INFINITY:
						return Double.POSITIVE_INFINITY;
					case RealNode.NEGATIVE_INFINITY:
						return Double.NEGATIVE_INFINITY;
					case RealNode.NEGATIVE_ZERO:
						return -0.0;
					default:
						throw new DecodeException("Unrecognized special REAL value '" + text + "' at " + location());
				}
			} else {
				throw wrongWire(node, "a number", wire);
			}
		}

		@Override
		public Object visitBoolean(BooleanNode node, JsonNode wire) {
			if (wire.isBoolean()) {
				return wire.booleanValue();
			} else {
				throw wrongWire(node, "a boolean", wire);
			}
		}

		@Override
		public Object visitNull(NullNode node, JsonNode wire) {
			if (wire.isNull()) {
				return null;
			} else {
				throw wrongWire(node, "null", wire);
			}
		}

		@Override
		public Object visitEnumerated(EnumeratedNode node, JsonNode wire) {
			if (!wire.isString()) {
				throw wrongWire(node, "an identifier string", wire);
			}
			String name = wire.stringValue();
			if (!node.hasName(name)) {
				throw new DecodeException("Enumeration value '" + name + "' not found in " + node.names() + " at " + location());
			}
			return name;
		}

		@Override
		public Object visitCharacterString(CharacterStringNode node, JsonNode wire) {
			if (wire.isString()) {
				return wire.stringValue();
			} else {
				throw wrongWire(node, "a string", wire);
			}
		}

		@Override
		public Object visitBitString(BitStringNode node, JsonNode wire) {
			if (!wire.isObject()) {
				throw wrongWire(node, "an object", wire);
			}
			JsonNode value = wire.get(BitStringNode.VALUE_MEMBER);
			JsonNode length = wire.get(BitStringNode.LENGTH_MEMBER);
			if (value == null || !value.isString()) {
				throw new DecodeException("BIT STRING needs a string '" + BitStringNode.VALUE_MEMBER + "' member at " + location());
			}
			if (length == null || !length.isIntegralNumber() || !length.canConvertToInt()) {
				throw new DecodeException("BIT STRING needs an integer '" + BitStringNode.LENGTH_MEMBER + "' member at " + location());
			}
			byte[] bytes = parseHex(value.stringValue());
			try {
				return new BitString(bytes, length.intValue());
			} catch (IllegalArgumentException e) {
				throw new DecodeException("Invalid BIT STRING at " + location() + ": " + e.getMessage(), e);
			}
		}

		@Override
		public Object visitOctetString(OctetStringNode node, JsonNode wire) {
			if (wire.isString()) {
				return parseHex(wire.stringValue());
			} else {
				throw wrongWire(node, "a hexadecimal string", wire);
			}
		}

		@Override
		public Object visitObjectIdentifier(ObjectIdentifierNode node, JsonNode wire) {
			if (!wire.isString()) {
				throw wrongWire(node, "a dotted-decimal string", wire);
			}
			String text = wire.stringValue();
			if (!ObjectIdentifierNode.isValid(text)) {
				throw new DecodeException("Malformed object identifier '" + text + "' at " + location());
			}
			return text;
		}

		@Override
		public Object visitSequence(SequenceNode node, JsonNode wire) {
			return decodeMembers(node, wire);
		}

		@Override
		public Object visitSet(SetNode node, JsonNode wire) {
			return decodeMembers(node, wire);
		}

		@Override
		public Object visitChoice(ChoiceNode node, JsonNode wire) {
			if (!wire.isObject() || wire.size() != 1) {
				throw new DecodeException("Expected an object with exactly one member for CHOICE but got "
					+ wire.getNodeType() + " of size " + wire.size() + " at " + location());
			}
			Map.Entry<String, JsonNode> entry = wire.properties().iterator().next();
			String name = entry.getKey();
			Field alternative = node.alternative(name).orElseThrow(() -> new DecodeException(
				"Unrecognized CHOICE alternative '" + name + "'; expected one of " + node.fieldNames() + " at " + location()));
			Map<String, Object> result = new LinkedHashMap<>();
			result.put(name, decodeNested(name, alternative.node(), entry.getValue()));
			return result;
		}

		@Override
		public Object visitSequenceOf(SequenceOfNode node, JsonNode wire) {
			return decodeElements(node, wire);
		}

		@Override
		public Object visitSetOf(SetOfNode node, JsonNode wire) {
			return decodeElements(node, wire);
		}

		@Override
		public Object visitAny(AnyNode node, JsonNode wire) {
			return wire.deepCopy();
		}

		@Override
		public Object visitTypeRef(TypeRefNode node, JsonNode wire) {
			return resolve(node).accept(this, wire);
		}

		private Object decodeMembers(MemberListNode node, JsonNode wire) {
			if (!wire.isObject()) {
				throw wrongWire(node, "an object", wire);
			}
			Map<String, Object> result = new LinkedHashMap<>();
			for (Field field : node.fields()) {
				String name = field.name();
				JsonNode memberWire = wire.get(name);
				if (memberWire != null) {
					result.put(name, decodeNested(name, field.node(), memberWire));
				} else if (field.optional()) {
					LOGGER.trace("Optional member '{}' absent at {}", name, location());
				} else if (field.hasDefault()) {
					result.put(name, field.defaultValue());
				} else if (settings.absentMemberPolicy() == STRICT) {
					throw new DecodeException(node.briefIdentifier() + " member '" + name + "' is required but absent at " + location());
				} else {
					LOGGER.debug("Required member '{}' absent at {}; leaving it out", name, location());
				}
			}
			return result;
		}

		private Object decodeElements(CollectionNode node, JsonNode wire) {
			if (!wire.isArray()) {
				throw wrongWire(node, "an array", wire);
			}
			List<Object> result = new ArrayList<>(wire.size());
			for (int i = 0; i < wire.size(); i++) {
				result.add(decodeNested(Integer.toString(i), node.element(), wire.get(i)));
			}
			return result;
		}

		private Object decodeNested(String segment, TypeNode node, JsonNode wire) {
			enter(segment);
			try {
				return node.accept(this, wire);
			} finally {
				exit();
			}
		}

		private byte[] parseHex(String text) {
			try {
				return HEX.parseHex(text);
			} catch (IllegalArgumentException e) {
				throw new DecodeException("Invalid hexadecimal string at " + location() + ": " + e.getMessage(), e);
			}
		}

		private DecodeException wrongWire(TypeNode node, String expected, JsonNode wire) {
			return new DecodeException("Expected " + expected + " for " + node.briefIdentifier()
				+ " but got " + wire.getNodeType() + " at " + location());
		}
	}

	private static final HexFormat HEX = HexFormat.of();
	private static final Logger LOGGER = LoggerFactory.getLogger(NodeInterpretingDecoder.class);
}
