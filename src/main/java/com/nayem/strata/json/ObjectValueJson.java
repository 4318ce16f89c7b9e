package com.nayem.strata.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.ArrayValue;
import com.nayem.strata.model.value.BooleanValue;
import com.nayem.strata.model.value.DoubleValue;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.IntegerValue;
import com.nayem.strata.model.value.NullValue;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.model.value.ServerTimestampBehavior;
import com.nayem.strata.model.value.ServerTimestampValue;
import com.nayem.strata.model.value.StringValue;
import com.nayem.strata.model.value.TimestampValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders {@link ObjectValue}s as JSON and parses JSON objects into them, for logs,
 * debugging tools and test fixtures.
 * <p>
 * The mapping is lossy: timestamps render as ISO-8601 strings and
 * parse back as strings, and pending server timestamps render according to a
 * {@link ServerTimestampBehavior}. It is not a storage or wire format.
 * </p>
 */
public class ObjectValueJson {

    private final ObjectMapper objectMapper;

    public ObjectValueJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectValueJson() {
        this(new ObjectMapper());
    }

    /**
     * Parses a JSON object. Integral numbers become {@link IntegerValue}s, other numbers
     * {@link DoubleValue}s.
     *
     * @throws IllegalArgumentException if {@code json} is malformed or not an object
     */
    public ObjectValue parse(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON document: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object but got: " + json);
        }
        return toObjectValue((ObjectNode) node);
    }

    /** Renders {@code value} with pending server timestamps read as null. */
    public String write(ObjectValue value) {
        return write(value, ServerTimestampBehavior.NONE);
    }

    public String write(ObjectValue value, ServerTimestampBehavior behavior) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(value, behavior));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render document as JSON", e);
        }
    }

    public JsonNode toJsonNode(FieldValue value, ServerTimestampBehavior behavior) {
        JsonNodeFactory nodes = objectMapper.getNodeFactory();
        if (value instanceof ObjectValue object) {
            ObjectNode node = nodes.objectNode();
            for (Map.Entry<String, FieldValue> entry : object.getFields().entrySet()) {
                node.set(entry.getKey(), toJsonNode(entry.getValue(), behavior));
            }
            return node;
        } else if (value instanceof ArrayValue array) {
            ArrayNode node = nodes.arrayNode();
            for (FieldValue element : array.getValues()) {
                node.add(toJsonNode(element, behavior));
            }
            return node;
        } else if (value instanceof ServerTimestampValue serverTimestamp) {
            FieldValue previous = serverTimestamp.getPreviousValue();
            return switch (behavior) {
                case ESTIMATE -> nodes.textNode(isoString(serverTimestamp.getLocalWriteTime()));
                case PREVIOUS -> previous == null ? nodes.nullNode() : toJsonNode(previous, behavior);
                case NONE -> nodes.nullNode();
            };
        } else if (value instanceof TimestampValue timestamp) {
            return nodes.textNode(isoString(timestamp.getTimestamp()));
        } else if (value instanceof IntegerValue integer) {
            return nodes.numberNode(integer.getLong());
        } else if (value instanceof DoubleValue number) {
            return nodes.numberNode(number.getDouble());
        } else if (value instanceof StringValue || value instanceof BooleanValue) {
            return objectMapper.valueToTree(value.value());
        }
        return nodes.nullNode();
    }

    private static String isoString(Timestamp timestamp) {
        return timestamp.toInstant().toString();
    }

    private FieldValue toFieldValue(JsonNode node) {
        if (node.isObject()) {
            return toObjectValue((ObjectNode) node);
        } else if (node.isArray()) {
            List<FieldValue> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(toFieldValue(element));
            }
            return ArrayValue.of(values);
        } else if (node.isIntegralNumber() && node.canConvertToLong()) {
            return IntegerValue.of(node.longValue());
        } else if (node.isNumber()) {
            return DoubleValue.of(node.doubleValue());
        } else if (node.isTextual()) {
            return StringValue.of(node.textValue());
        } else if (node.isBoolean()) {
            return BooleanValue.of(node.booleanValue());
        }
        return NullValue.INSTANCE;
    }

    private ObjectValue toObjectValue(ObjectNode node) {
        Map<String, FieldValue> fields = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), toFieldValue(entry.getValue()));
        }
        return ObjectValue.of(fields);
    }
}
