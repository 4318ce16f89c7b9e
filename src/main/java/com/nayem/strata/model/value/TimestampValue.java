package com.nayem.strata.model.value;

import com.nayem.strata.model.Timestamp;

import java.util.Objects;

public final class TimestampValue extends FieldValue {

    private final Timestamp value;

    private TimestampValue(Timestamp value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static TimestampValue of(Timestamp value) {
        return new TimestampValue(value);
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_TIMESTAMP;
    }

    @Override
    public Timestamp value(ServerTimestampBehavior behavior) {
        return value;
    }

    public Timestamp getTimestamp() {
        return value;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        if (other instanceof TimestampValue that) {
            return value.compareTo(that.value);
        }
        // Pending server timestamps sort after every resolved timestamp.
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TimestampValue other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
