package com.nayem.strata.model.value;

public final class IntegerValue extends NumberValue {

    private final long value;

    private IntegerValue(long value) {
        this.value = value;
    }

    public static IntegerValue of(long value) {
        return new IntegerValue(value);
    }

    public long getLong() {
        return value;
    }

    @Override
    double toDouble() {
        return value;
    }

    @Override
    public Long value(ServerTimestampBehavior behavior) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerValue other && value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
