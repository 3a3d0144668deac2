package org.ledgerwire.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON state blobs that keep the Java type of each value.
 * <p>
 * Strings, booleans and ints are written as plain JSON values. Every other supported value is written as a
 * single-field object naming its type:
 * <pre>
 * {"long":5}  {"short":3}  {"byte":1}  {"float":"1.5"}  {"double":"2.5"}
 * {"bigint":"123"}  {"decimal":"1.50"}  {"bytes":"AQID"}
 * {"list":[...]}  {"set":[...]}  {"map":[[key, value], ...]}
 * </pre>
 * Lists, sets and maps come back as Guava immutable collections, equal to the originals. Byte arrays come back as
 * copies, so compare them by content. Nulls, and any other type, are rejected.
 * <p>
 * Only the tags above are read from a blob. Class names are never read.
 */
public class JsonStateCodec implements StateCodec {

	private static final String LONG = "long";
	private static final String SHORT = "short";
	private static final String BYTE = "byte";
	private static final String FLOAT = "float";
	private static final String DOUBLE = "double";
	private static final String BIG_INTEGER = "bigint";
	private static final String BIG_DECIMAL = "decimal";
	private static final String BYTES = "bytes";
	private static final String LIST = "list";
	private static final String SET = "set";
	private static final String MAP = "map";

	private final ObjectMapper mapper;
	private final JsonNodeFactory nodes;

	public JsonStateCodec() {
		this(new ObjectMapper());
	}

	public JsonStateCodec(ObjectMapper mapper) {
		this.mapper = mapper.copy()
				.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		this.nodes = this.mapper.getNodeFactory();
	}

	@Override
	public byte[] serialize(Object state) throws StateCodecException {
		JsonNode node = this.toNode(state);

		try {
			return this.mapper.writeValueAsBytes(node);
		} catch (JsonProcessingException e) {
			throw new StateCodecException("Unable to serialize state", e);
		}
	}

	@Override
	public Object deserialize(byte[] blob) throws StateCodecException {
		if (blob == null || blob.length == 0)
			throw new StateCodecException("Empty state blob");

		JsonNode node;
		try {
			node = this.mapper.readTree(blob);
		} catch (IOException e) {
			throw new StateCodecException("Unable to deserialize state: " + e.getMessage(), e);
		}

		if (node == null || node.isMissingNode())
			throw new StateCodecException("Empty state blob");

		return this.fromNode(node);
	}

	private JsonNode toNode(Object value) throws StateCodecException {
		if (value == null)
			throw new StateCodecException("Null state values are not supported");

		if (value instanceof String)
			return this.nodes.textNode((String) value);

		if (value instanceof Boolean)
			return this.nodes.booleanNode((Boolean) value);

		if (value instanceof Integer)
			return this.nodes.numberNode((Integer) value);

		if (value instanceof Long)
			return this.tagged(LONG, this.nodes.numberNode((Long) value));

		if (value instanceof Short)
			return this.tagged(SHORT, this.nodes.numberNode((Short) value));

		if (value instanceof Byte)
			return this.tagged(BYTE, this.nodes.numberNode((Byte) value));

		// Text keeps NaN, infinities and the exact decimal rendering
		if (value instanceof Float)
			return this.tagged(FLOAT, this.nodes.textNode(value.toString()));

		if (value instanceof Double)
			return this.tagged(DOUBLE, this.nodes.textNode(value.toString()));

		if (value instanceof BigInteger)
			return this.tagged(BIG_INTEGER, this.nodes.textNode(value.toString()));

		if (value instanceof BigDecimal)
			return this.tagged(BIG_DECIMAL, this.nodes.textNode(value.toString()));

		if (value instanceof byte[])
			return this.tagged(BYTES, this.nodes.binaryNode((byte[]) value));

		if (value instanceof List)
			return this.tagged(LIST, this.toArrayNode((List<?>) value));

		if (value instanceof Set)
			return this.tagged(SET, this.toArrayNode((Set<?>) value));

		if (value instanceof Map) {
			ArrayNode entries = this.nodes.arrayNode();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
				entries.add(this.nodes.arrayNode()
						.add(this.toNode(entry.getKey()))
						.add(this.toNode(entry.getValue())));

			return this.tagged(MAP, entries);
		}

		throw new StateCodecException(String.format("Unsupported state type %s", value.getClass().getName()));
	}

	private ArrayNode toArrayNode(Collection<?> values) throws StateCodecException {
		ArrayNode array = this.nodes.arrayNode();
		for (Object value : values)
			array.add(this.toNode(value));

		return array;
	}

	private ObjectNode tagged(String tag, JsonNode value) {
		ObjectNode node = this.nodes.objectNode();
		node.set(tag, value);
		return node;
	}

	private Object fromNode(JsonNode node) throws StateCodecException {
		if (node.isTextual())
			return node.textValue();

		if (node.isBoolean())
			return node.booleanValue();

		if (node.isInt())
			return node.intValue();

		if (!node.isObject() || node.size() != 1)
			throw new StateCodecException(String.format("Unexpected state value %s", node.getNodeType()));

		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		Map.Entry<String, JsonNode> field = fields.next();
		String tag = field.getKey();
		JsonNode value = field.getValue();

		try {
			switch (tag) {
				case LONG:
					if (!value.isIntegralNumber() || !value.canConvertToLong())
						throw new StateCodecException("Invalid long state value");
					return value.longValue();

				case SHORT:
					return (short) requireIntInRange(value, Short.MIN_VALUE, Short.MAX_VALUE);

				case BYTE:
					return (byte) requireIntInRange(value, Byte.MIN_VALUE, Byte.MAX_VALUE);

				case FLOAT:
					return Float.valueOf(requireText(value));

				case DOUBLE:
					return Double.valueOf(requireText(value));

				case BIG_INTEGER:
					return new BigInteger(requireText(value));

				case BIG_DECIMAL:
					return new BigDecimal(requireText(value));

				case BYTES:
					requireText(value);
					return value.binaryValue();

				case LIST: {
					ImmutableList.Builder<Object> list = ImmutableList.builderWithExpectedSize(requireArray(value).size());
					for (JsonNode element : value)
						list.add(this.fromNode(element));

					return list.build();
				}

				case SET: {
					Set<Object> set = new LinkedHashSet<>();
					for (JsonNode element : requireArray(value))
						if (!set.add(this.fromNode(element)))
							throw new StateCodecException("Duplicate set element in state value");

					return ImmutableSet.copyOf(set);
				}

				case MAP: {
					Map<Object, Object> map = new LinkedHashMap<>();
					for (JsonNode entry : requireArray(value)) {
						if (!entry.isArray() || entry.size() != 2)
							throw new StateCodecException("Map entries must be [key, value] pairs");

						if (map.put(this.fromNode(entry.get(0)), this.fromNode(entry.get(1))) != null)
							throw new StateCodecException("Duplicate map key in state value");
					}

					return ImmutableMap.copyOf(map);
				}

				default:
					throw new StateCodecException(String.format("Unknown state value tag \"%s\"", tag));
			}
		} catch (IOException | IllegalArgumentException e) {
			throw new StateCodecException(String.format("Invalid %s state value: %s", tag, e.getMessage()), e);
		}
	}

	private static int requireIntInRange(JsonNode value, int min, int max) throws StateCodecException {
		if (!value.isInt() || value.intValue() < min || value.intValue() > max)
			throw new StateCodecException("State value out of range");

		return value.intValue();
	}

	private static String requireText(JsonNode value) throws StateCodecException {
		if (!value.isTextual())
			throw new StateCodecException("Expected text in state value");

		return value.textValue();
	}

	private static JsonNode requireArray(JsonNode value) throws StateCodecException {
		if (!value.isArray())
			throw new StateCodecException("Expected array in state value");

		return value;
	}

}
