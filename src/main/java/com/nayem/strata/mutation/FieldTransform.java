package com.nayem.strata.mutation;

import com.nayem.strata.model.FieldPath;

import java.util.Objects;

/**
 * A field path and the transform to run on it.
 */
public record FieldTransform(FieldPath fieldPath, TransformOperation operation) {

    public FieldTransform {
        Objects.requireNonNull(fieldPath, "fieldPath");
        Objects.requireNonNull(operation, "operation");
    }
}
