package com.nayem.strata.model.value;

/**
 * Base for integer and double values, which order together numerically.
 * NaN sorts before every other number.
 */
public abstract class NumberValue extends FieldValue {

    NumberValue() {
    }

    @Override
    public int typeOrder() {
        return TYPE_ORDER_NUMBER;
    }

    @Override
    protected int compareToSameType(FieldValue other) {
        if (this instanceof IntegerValue self && other instanceof IntegerValue that) {
            return Long.compare(self.getLong(), that.getLong());
        }
        double left = toDouble();
        double right = ((NumberValue) other).toDouble();
        if (Double.isNaN(left)) {
            return Double.isNaN(right) ? 0 : -1;
        }
        if (Double.isNaN(right)) {
            return 1;
        }
        return Double.compare(left, right);
    }

    abstract double toDouble();
}
