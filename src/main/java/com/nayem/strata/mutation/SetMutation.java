package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.util.Assert;

import java.util.Objects;

/**
 * Creates the document, or replaces its entire contents with {@code value}.
 */
public final class SetMutation extends Mutation {

    private final ObjectValue value;

    public SetMutation(DocumentKey key, ObjectValue value, Precondition precondition) {
        super(key, precondition);
        this.value = Objects.requireNonNull(value, "value");
    }

    public ObjectValue getValue() {
        return value;
    }

    @Override
    public MutationType getType() {
        return MutationType.SET;
    }

    @Override
    public MaybeDocument applyToRemoteDocument(MaybeDocument maybeDoc, MutationResult mutationResult) {
        verifyKeyMatches(maybeDoc);
        Assert.hardAssert(mutationResult.transformResults() == null,
                "Transform results received by SetMutation.");

        // The backend accepted the write, so the precondition held.
        return new Document(getKey(), getPostMutationVersion(maybeDoc), value, false);
    }

    @Override
    public MaybeDocument applyToLocalView(MaybeDocument maybeDoc, MaybeDocument baseDoc, Timestamp localWriteTime) {
        verifyKeyMatches(maybeDoc);

        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        return new Document(getKey(), getPostMutationVersion(maybeDoc), value, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SetMutation other && hasSameKeyAndPrecondition(other) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * keyAndPreconditionHashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "SetMutation{key=" + getKey() + ", value=" + value + ", precondition=" + getPrecondition() + "}";
    }
}
