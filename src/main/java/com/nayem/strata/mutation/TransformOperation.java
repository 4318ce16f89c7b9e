package com.nayem.strata.mutation;

import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.util.Assert;

/**
 * A field-level operation whose result the backend computes, e.g. a server timestamp.
 * <p>
 * Each kind of transform knows how to estimate its result locally and how to store
 * the result the backend returns. A kind that does not override one of these methods
 * cannot be applied on that path; attempting it is an invariant violation.
 * Implementations must be immutable and define value equality.
 * </p>
 */
public interface TransformOperation {

    /**
     * Computes the value to store locally before the backend has run the transform.
     *
     * @param previousValue  the field's value before the mutation batch, or null
     * @param localWriteTime the local time of the write
     */
    default FieldValue applyToLocalView(FieldValue previousValue, Timestamp localWriteTime) {
        throw Assert.fail("Encountered unknown transform: %s", this);
    }

    /**
     * Computes the value to store once the backend has acknowledged the transform.
     *
     * @param previousValue   the field's current value, or null
     * @param transformResult the value the backend computed for this transform
     */
    default FieldValue applyToRemoteDocument(FieldValue previousValue, FieldValue transformResult) {
        throw Assert.fail("Encountered unknown transform: %s", this);
    }
}
