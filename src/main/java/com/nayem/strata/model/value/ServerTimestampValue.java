package com.nayem.strata.model.value;

import com.nayem.strata.model.Timestamp;

import java.util.Objects;

/**
 * Placeholder for a server-assigned timestamp that the backend has not produced yet.
 * <p>
 * It keeps the local time of the write, used as an estimate, and the value the field
 * held before the write, so that reads can choose what to show while the write is
 * pending (see {@link ServerTimestampBehavior}). Never sent to the backend.
 * </p>
 */
public final class ServerTimestampValue extends FieldValue {

    private final Timestamp localWriteTime;
    private final FieldValue previousValue;

    public ServerTimestampValue(Timestamp localWriteTime, FieldValue previousValue) {
        this.localWriteTime = Objects.requireNonNull(localWriteTime, "localWriteTime");
        this.previousValue = previousValue;
    }

    public Timestamp getLocalWriteTime() {
        return localWriteTime;
    }

    /** The field's value before the write, or null if it had none. */
    public FieldValue getPreviousValue() {
        return previousValue;
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_TIMESTAMP;
    }

    @Override
    public Object value(ServerTimestampBehavior behavior) {
        switch (behavior) {
            case ESTIMATE:
                return localWriteTime;
            case PREVIOUS:
                return previousValue == null ? null : previousValue.value(behavior);
            case NONE:
            default:
                return null;
        }
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        if (other instanceof ServerTimestampValue that) {
            return localWriteTime.compareTo(that.localWriteTime);
        }
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ServerTimestampValue other
                && localWriteTime.equals(other.localWriteTime)
                && Objects.equals(previousValue, other.previousValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localWriteTime, previousValue);
    }

    @Override
    public String toString() {
        return "<ServerTimestamp localTime=" + localWriteTime + ">";
    }
}
