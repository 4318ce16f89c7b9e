package com.nayem.strata.model.value;

import com.nayem.strata.model.FieldPath;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable map of field names to values, addressed with {@link FieldPath}s.
 * <p>
 * Every modification returns a new instance and shares untouched sub-objects with
 * the original. Fields iterate in name order.
 * </p>
 */
public final class ObjectValue extends FieldValue {

    public static final ObjectValue EMPTY = new ObjectValue(Collections.emptySortedMap());

    private final SortedMap<String, FieldValue> fields;

    private ObjectValue(SortedMap<String, FieldValue> fields) {
        this.fields = fields;
    }

    public static ObjectValue of(Map<String, ? extends FieldValue> fields) {
        if (fields.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, FieldValue> copy = new TreeMap<>();
        for (Map.Entry<String, ? extends FieldValue> entry : fields.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "field name"),
                    Objects.requireNonNull(entry.getValue(), "field value"));
        }
        return new ObjectValue(Collections.unmodifiableSortedMap(copy));
    }

    /** Top-level fields in name order. */
    public SortedMap<String, FieldValue> getFields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns the value at {@code path}, or null if there is none. A path that runs
     * through a non-object value has no value.
     */
    public FieldValue field(FieldPath path) {
        FieldValue current = this;
        for (String segment : path.getSegments()) {
            if (!(current instanceof ObjectValue object)) {
                return null;
            }
            current = object.fields.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Returns a copy with {@code value} at {@code path}. Missing intermediate objects
     * are created; an intermediate value that is not an object is replaced by one.
     */
    public ObjectValue set(FieldPath path, FieldValue value) {
        Objects.requireNonNull(value, "value");
        String first = path.getFirstSegment();
        FieldPath rest = path.popFirst();
        if (rest == null) {
            return withField(first, value);
        }
        FieldValue child = fields.get(first);
        ObjectValue childObject = child instanceof ObjectValue object ? object : EMPTY;
        return withField(first, childObject.set(rest, value));
    }

    /**
     * Returns a copy without the value at {@code path}, or this instance if there is
     * nothing to delete.
     */
    public ObjectValue delete(FieldPath path) {
        String first = path.getFirstSegment();
        FieldPath rest = path.popFirst();
        if (rest == null) {
            if (!fields.containsKey(first)) {
                return this;
            }
            TreeMap<String, FieldValue> copy = new TreeMap<>(fields);
            copy.remove(first);
            return copy.isEmpty() ? EMPTY : new ObjectValue(Collections.unmodifiableSortedMap(copy));
        }
        FieldValue child = fields.get(first);
        if (!(child instanceof ObjectValue childObject)) {
            return this;
        }
        ObjectValue newChild = childObject.delete(rest);
        return newChild == childObject ? this : withField(first, newChild);
    }

    private ObjectValue withField(String name, FieldValue value) {
        TreeMap<String, FieldValue> copy = new TreeMap<>(fields);
        copy.put(name, value);
        return new ObjectValue(Collections.unmodifiableSortedMap(copy));
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_OBJECT;
    }

    @Override
    public Map<String, Object> value(ServerTimestampBehavior behavior) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            result.put(entry.getKey(), entry.getValue().value(behavior));
        }
        return result;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        Iterator<Map.Entry<String, FieldValue>> left = fields.entrySet().iterator();
        Iterator<Map.Entry<String, FieldValue>> right = ((ObjectValue) other).fields.entrySet().iterator();
        while (left.hasNext() && right.hasNext()) {
            Map.Entry<String, FieldValue> l = left.next();
            Map.Entry<String, FieldValue> r = right.next();
            int cmp = l.getKey().compareTo(r.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = l.getValue().compareTo(r.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ObjectValue other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
