package com.nayem.strata.model.value;

import java.util.ArrayList;
import java.util.List;

public final class ArrayValue extends FieldValue {

    private final List<FieldValue> values;

    private ArrayValue(List<FieldValue> values) {
        this.values = List.copyOf(values);
    }

    public static ArrayValue of(List<FieldValue> values) {
        return new ArrayValue(values);
    }

    public List<FieldValue> getValues() {
        return values;
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_ARRAY;
    }

    @Override
    public List<Object> value(ServerTimestampBehavior behavior) {
        List<Object> result = new ArrayList<>(values.size());
        for (FieldValue value : values) {
            result.add(value.value(behavior));
        }
        return result;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        List<FieldValue> others = ((ArrayValue) other).values;
        int limit = Math.min(values.size(), others.size());
        for (int i = 0; i < limit; i++) {
            int cmp = values.get(i).compareTo(others.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), others.size());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayValue other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
