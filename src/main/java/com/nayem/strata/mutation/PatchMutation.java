package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.FieldPath;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.util.Assert;

import java.util.Objects;

/**
 * Modifies the fields of a document named by a {@link FieldMask}:
 * <ul>
 * <li>a field in the mask and in {@code data} is set to the value in {@code data};</li>
 * <li>a field in the mask but not in {@code data} is deleted;</li>
 * <li>a field in {@code data} but not in the mask is ignored;</li>
 * <li>a field in neither is left as it was.</li>
 * </ul>
 */
public final class PatchMutation extends Mutation {

    private final ObjectValue data;
    private final FieldMask fieldMask;

    public PatchMutation(DocumentKey key, ObjectValue data, FieldMask fieldMask, Precondition precondition) {
        super(key, precondition);
        this.data = Objects.requireNonNull(data, "data");
        this.fieldMask = Objects.requireNonNull(fieldMask, "fieldMask");
    }

    public ObjectValue getData() {
        return data;
    }

    public FieldMask getMask() {
        return fieldMask;
    }

    @Override
    public MutationType getType() {
        return MutationType.PATCH;
    }

    @Override
    public MaybeDocument applyToRemoteDocument(MaybeDocument maybeDoc, MutationResult mutationResult) {
        verifyKeyMatches(maybeDoc);
        Assert.hardAssert(mutationResult.transformResults() == null,
                "Transform results received by PatchMutation.");

        // The backend already checked the precondition, but without a cached base
        // document a patch would write a partial document into the cache.
        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        return new Document(getKey(), getPostMutationVersion(maybeDoc), patchDocument(maybeDoc), false);
    }

    @Override
    public MaybeDocument applyToLocalView(MaybeDocument maybeDoc, MaybeDocument baseDoc, Timestamp localWriteTime) {
        verifyKeyMatches(maybeDoc);

        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        return new Document(getKey(), getPostMutationVersion(maybeDoc), patchDocument(maybeDoc), true);
    }

    /**
     * Patches the data of {@code maybeDoc}, or an empty object if it is not a document.
     * Does not check the precondition.
     */
    private ObjectValue patchDocument(MaybeDocument maybeDoc) {
        ObjectValue base = maybeDoc instanceof Document document ? document.getData() : ObjectValue.EMPTY;
        return patchObject(base);
    }

    private ObjectValue patchObject(ObjectValue base) {
        ObjectValue result = base;
        for (FieldPath path : fieldMask.getMask()) {
            FieldValue newValue = data.field(path);
            if (newValue != null) {
                result = result.set(path, newValue);
            } else {
                result = result.delete(path);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PatchMutation other
                && hasSameKeyAndPrecondition(other)
                && fieldMask.equals(other.fieldMask)
                && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyAndPreconditionHashCode(), fieldMask, data);
    }

    @Override
    public String toString() {
        return "PatchMutation{key=" + getKey() + ", mask=" + fieldMask + ", data=" + data
                + ", precondition=" + getPrecondition() + "}";
    }
}
