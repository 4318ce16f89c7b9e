package com.nayem.strata.model.value;

import com.nayem.strata.model.Timestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Conversions from plain Java objects to {@link FieldValue}s.
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * Wraps {@code value}. Supports null, booleans, integral and floating-point numbers,
     * strings, {@link Timestamp}s, {@link Instant}s, collections, string-keyed maps and
     * existing {@link FieldValue}s.
     *
     * @throws IllegalArgumentException for any other type
     */
    public static FieldValue wrap(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        } else if (value instanceof FieldValue fieldValue) {
            return fieldValue;
        } else if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return IntegerValue.of(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            return DoubleValue.of(((Number) value).doubleValue());
        } else if (value instanceof String string) {
            return StringValue.of(string);
        } else if (value instanceof Timestamp timestamp) {
            return TimestampValue.of(timestamp);
        } else if (value instanceof Instant instant) {
            return TimestampValue.of(Timestamp.ofInstant(instant));
        } else if (value instanceof Collection<?> collection) {
            List<FieldValue> values = new ArrayList<>(collection.size());
            for (Object element : collection) {
                values.add(wrap(element));
            }
            return ArrayValue.of(values);
        } else if (value instanceof Map<?, ?> map) {
            return wrapObject(map);
        }
        throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getName());
    }

    /**
     * Wraps a string-keyed map as an {@link ObjectValue}.
     *
     * @throws IllegalArgumentException if a key is not a string or a value is unsupported
     */
    public static ObjectValue wrapObject(Map<?, ?> map) {
        Map<String, FieldValue> fields = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new IllegalArgumentException("Field names must be strings, got: " + entry.getKey());
            }
            fields.put(name, wrap(entry.getValue()));
        }
        return ObjectValue.of(fields);
    }
}
