package com.nayem.strata.model.value;

/**
 * An immutable value stored in a document field.
 * <p>
 * Values of different kinds order by {@link #typeOrder()}: null, booleans, numbers,
 * timestamps (pending server timestamps last), strings, arrays, objects. Integer and
 * double values share the number slot and compare numerically, but an integer is
 * never {@code equals} to a double.
 * </p>
 */
public abstract class FieldValue implements Comparable<FieldValue> {

    static final int TYPE_ORDER_NULL = 0;
    static final int TYPE_ORDER_BOOLEAN = 1;
    static final int TYPE_ORDER_NUMBER = 2;
    static final int TYPE_ORDER_TIMESTAMP = 3;
    static final int TYPE_ORDER_STRING = 4;
    static final int TYPE_ORDER_ARRAY = 5;
    static final int TYPE_ORDER_OBJECT = 6;

    FieldValue() {
    }

    public abstract int typeOrder();

    /**
     * Converts this value into plain Java objects, resolving pending server timestamps
     * with {@code behavior}.
     */
    public abstract Object value(ServerTimestampBehavior behavior);

    /** Converts this value into plain Java objects; pending server timestamps read as null. */
    public Object value() {
        return value(ServerTimestampBehavior.NONE);
    }

    /** Compares against a value of the same {@link #typeOrder()}. */
    protected abstract int compareToSameType(FieldValue other);

    @Override
    public int compareTo(FieldValue other) {
        int cmp = Integer.compare(typeOrder(), other.typeOrder());
        return cmp != 0 ? cmp : compareToSameType(other);
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
        return String.valueOf(value());
    }
}
