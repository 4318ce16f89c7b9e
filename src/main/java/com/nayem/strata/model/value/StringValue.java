package com.nayem.strata.model.value;

import java.util.Objects;

public final class StringValue extends FieldValue {

    private final String value;

    private StringValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_STRING;
    }

    @Override
    public String value(ServerTimestampBehavior behavior) {
        return value;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        return value.compareTo(((StringValue) other).value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringValue other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
