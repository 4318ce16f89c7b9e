package com.nayem.strata.model.value;

public final class DoubleValue extends NumberValue {

    public static final DoubleValue NaN = new DoubleValue(Double.NaN);

    private final double value;

    private DoubleValue(double value) {
        this.value = value;
    }

    public static DoubleValue of(double value) {
        return Double.isNaN(value) ? NaN : new DoubleValue(value);
    }

    public double getDouble() {
        return value;
    }

    @Override
    double toDouble() {
        return value;
    }

    @Override
    public Double value(ServerTimestampBehavior behavior) {
        return value;
    }

    // Bitwise equality: NaN equals NaN, 0.0 differs from -0.0.
    @Override
    public boolean equals(Object o) {
        return o instanceof DoubleValue other
                && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
