package com.nayem.strata.model.value;

public final class NullValue extends FieldValue {

    public static final NullValue INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_NULL;
    }

    @Override
    public Object value(ServerTimestampBehavior behavior) {
        return null;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NullValue;
    }

    @Override
    public int hashCode() {
        return -1;
    }
}
