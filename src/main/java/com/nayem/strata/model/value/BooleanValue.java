package com.nayem.strata.model.value;

public final class BooleanValue extends FieldValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_BOOLEAN;
    }

    @Override
    public Boolean value(ServerTimestampBehavior behavior) {
        return value;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        return Boolean.compare(value, ((BooleanValue) other).value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BooleanValue other && value == other.value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
