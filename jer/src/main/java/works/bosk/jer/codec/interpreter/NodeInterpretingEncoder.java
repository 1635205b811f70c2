package works.bosk.jer.codec.interpreter;

import java.math.BigInteger;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.bosk.jer.BitString;
import works.bosk.jer.codec.CodecSettings;
import works.bosk.jer.codec.Encoder;
import works.bosk.jer.exceptions.EncodeException;
import works.bosk.jer.exceptions.JerException;
import works.bosk.jer.exceptions.MissingRequiredFieldException;
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
import static works.bosk.jer.codec.CodecSettings.DefaultElision.OMIT_WHEN_EQUAL;

/**
 * Walks a {@link TypeNode} tree alongside a native value, building the
 * corresponding {@link JsonNode}.
 * <p>
 * Thread-safe: each call to {@link #encode} gets its own {@link Session}.
 */
public final class NodeInterpretingEncoder implements Encoder {
	private final TypeNode node;
	private final SchemaMap schemaMap;
	private final CodecSettings settings;

	public NodeInterpretingEncoder(TypeNode node, SchemaMap schemaMap, CodecSettings settings) {
		this.node = requireNonNull(node);
		this.schemaMap = requireNonNull(schemaMap);
		this.settings = requireNonNull(settings);
	}

	@Override
	public JsonNode encode(Object value) {
		LOGGER.debug("Encoding {} as {}", describe(value), node.briefIdentifier());
		return node.accept(new Session(schemaMap, settings), value);
	}

	private static final class Session extends TranscodingSession implements TypeNode.Visitor<Object, JsonNode> {
		Session(SchemaMap schemaMap, CodecSettings settings) {
			super(schemaMap, settings);
		}

		@Override
		JerException failure(String message) {
			return new EncodeException(message);
		}

		@Override
		public JsonNode visitInteger(IntegerNode node, Object value) {
			if (value instanceof BigInteger b) {
				return NODES.numberNode(b);
			} else if (value instanceof Number n && NativeValues.isIntegral(n)) {
				return NODES.numberNode(n.longValue());
			} else {
				throw wrongType(node, "an integral Number", value);
			}
		}

		@Override
		public JsonNode visitReal(RealNode node, Object value) {
			if (!(value instanceof Number n)) {
				throw wrongType(node, "a Number", value);
			}
			double d = n.doubleValue();
			if (Double.isNaN(d)) {
				return NODES.stringNode(RealNode.NOT_A_NUMBER);
			} else if (d == Double.POSITIVE_INFINITY) {
				return NODES.stringNode(RealNode.POSITIVE_INFINITY);
			} else if (d == Double.NEGATIVE_INFINITY) {
				return NODES.stringNode(RealNode.NEGATIVE_INFINITY);
			} else if (Double.doubleToRawLongBits(d) == NEGATIVE_ZERO_BITS) {
				return NODES.stringNode(RealNode.NEGATIVE_ZERO);
			} else {
				return NODES.numberNode(d);
			}
		}

		@Override
		public JsonNode visitBoolean(BooleanNode node, Object value) {
			if (value instanceof Boolean b) {
				return NODES.booleanNode(b);
			} else {
				throw wrongType(node, "a Boolean", value);
			}
		}

		@Override
		public JsonNode visitNull(NullNode node, Object value) {
			if (value == null) {
				return NODES.nullNode();
			} else {
				throw wrongType(node, "null", value);
			}
		}

		@Override
		public JsonNode visitEnumerated(EnumeratedNode node, Object value) {
			String name;
			if (value instanceof Enum<?> e) {
				name = e.name();
			} else if (value instanceof CharSequence cs) {
				name = cs.toString();
			} else {
				throw wrongType(node, "an identifier", value);
			}
			if (!node.hasName(name)) {
				throw new EncodeException("Enumeration value '" + name + "' not found in " + node.names() + " at " + location());
			}
			return NODES.stringNode(name);
		}

		@Override
		public JsonNode visitCharacterString(CharacterStringNode node, Object value) {
			if (value instanceof CharSequence cs) {
				return NODES.stringNode(cs.toString());
			} else {
				throw wrongType(node, "a String", value);
			}
		}

		@Override
		public JsonNode visitBitString(BitStringNode node, Object value) {
			if (!(value instanceof BitString bits)) {
				throw wrongType(node, "a BitString", value);
			}
			ObjectNode result = NODES.objectNode();
			result.put(BitStringNode.VALUE_MEMBER, HEX.formatHex(bits.bytes()));
			result.put(BitStringNode.LENGTH_MEMBER, bits.length());
			return result;
		}

		@Override
		public JsonNode visitOctetString(OctetStringNode node, Object value) {
			if (value instanceof byte[] bytes) {
				return NODES.stringNode(HEX.formatHex(bytes));
			} else {
				throw wrongType(node, "a byte[]", value);
			}
		}

		@Override
		public JsonNode visitObjectIdentifier(ObjectIdentifierNode node, Object value) {
			if (!(value instanceof CharSequence cs)) {
				throw wrongType(node, "a dotted-decimal String", value);
			}
			if (!ObjectIdentifierNode.isValid(cs)) {
				throw new EncodeException("Malformed object identifier '" + cs + "' at " + location());
			}
			return NODES.stringNode(cs.toString());
		}

		@Override
		public JsonNode visitSequence(SequenceNode node, Object value) {
			return encodeMembers(node, value);
		}

		@Override
		public JsonNode visitSet(SetNode node, Object value) {
			return encodeMembers(node, value);
		}

		@Override
		public JsonNode visitChoice(ChoiceNode node, Object value) {
			Map<?, ?> map = asMap(node, value);
			List<Field> chosen = node.fields().stream()
				.filter(f -> map.containsKey(f.name()))
				.toList();
			if (chosen.size() != 1) {
				throw new EncodeException("Expected exactly one of the alternatives " + node.fieldNames()
					+ " but got " + map.keySet() + " at " + location());
			}
			Field alternative = chosen.get(0);
			ObjectNode result = NODES.objectNode();
			result.set(alternative.name(), encodeNested(alternative.name(), alternative.node(), map.get(alternative.name())));
			return result;
		}

		@Override
		public JsonNode visitSequenceOf(SequenceOfNode node, Object value) {
			return encodeElements(node, value);
		}

		@Override
		public JsonNode visitSetOf(SetOfNode node, Object value) {
			return encodeElements(node, value);
		}

		@Override
		public JsonNode visitAny(AnyNode node, Object value) {
			if (value instanceof JsonNode json) {
				return json.deepCopy();
			} else {
				throw wrongType(node, "a JsonNode", value);
			}
		}

		@Override
		public JsonNode visitTypeRef(TypeRefNode node, Object value) {
			return resolve(node).accept(this, value);
		}

		private JsonNode encodeMembers(MemberListNode node, Object value) {
			Map<?, ?> map = asMap(node, value);
			ObjectNode result = NODES.objectNode();
			for (Field field : node.fields()) {
				String name = field.name();
				if (map.containsKey(name)) {
					Object memberValue = map.get(name);
					if (isElided(field, memberValue)) {
						LOGGER.trace("Omitting member '{}' equal to its default at {}", name, location());
					} else {
						result.set(name, encodeNested(name, field.node(), memberValue));
					}
				} else if (field.isRequired()) {
					throw new MissingRequiredFieldException(name, node.briefIdentifier()
						+ " member '" + name + "' not found among " + map.keySet() + " at " + location());
				}
			}
			return result;
		}

		private boolean isElided(Field field, Object memberValue) {
			return settings.defaultElision() == OMIT_WHEN_EQUAL
				&& field.hasDefault()
				&& NativeValues.sameValue(memberValue, field.defaultValue());
		}

		private JsonNode encodeElements(CollectionNode node, Object value) {
			if (!(value instanceof Iterable<?> iterable)) {
				throw wrongType(node, "an Iterable", value);
			}
			ArrayNode result = NODES.arrayNode();
			int index = 0;
			for (Object element : iterable) {
				result.add(encodeNested(Integer.toString(index), node.element(), element));
				++index;
			}
			return result;
		}

		private JsonNode encodeNested(String segment, TypeNode node, Object value) {
			enter(segment);
			try {
				return node.accept(this, value);
			} finally {
				exit();
			}
		}

		private Map<?, ?> asMap(TypeNode node, Object value) {
			if (value instanceof Map<?, ?> map) {
				return map;
			} else {
				throw wrongType(node, "a Map", value);
			}
		}

		private EncodeException wrongType(TypeNode node, String expected, Object value) {
			return new EncodeException("Expected " + expected + " for " + node.briefIdentifier()
				+ " but got " + describe(value) + " at " + location());
		}
	}

	private static String describe(Object value) {
		return (value == null) ? "null" : value.getClass().getSimpleName();
	}

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
	private static final HexFormat HEX = HexFormat.of().withUpperCase();
	private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);
	private static final Logger LOGGER = LoggerFactory.getLogger(NodeInterpretingEncoder.class);
}
