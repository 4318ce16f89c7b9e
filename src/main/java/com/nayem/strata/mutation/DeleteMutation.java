package com.nayem.strata.mutation;

import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.NoDocument;
import com.nayem.strata.model.SnapshotVersion;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.util.Assert;

/** Deletes the document. */
public final class DeleteMutation extends Mutation {

    public DeleteMutation(DocumentKey key, Precondition precondition) {
        super(key, precondition);
    }

    @Override
    public MutationType getType() {
        return MutationType.DELETE;
    }

    @Override
    public MaybeDocument applyToRemoteDocument(MaybeDocument maybeDoc, MutationResult mutationResult) {
        verifyKeyMatches(maybeDoc);
        Assert.hardAssert(mutationResult.transformResults() == null,
                "Transform results received by DeleteMutation.");

        // The backend accepted the write, so the precondition held.
        return new NoDocument(getKey(), SnapshotVersion.MIN);
    }

    @Override
    public MaybeDocument applyToLocalView(MaybeDocument maybeDoc, MaybeDocument baseDoc, Timestamp localWriteTime) {
        verifyKeyMatches(maybeDoc);

        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        return new NoDocument(getKey(), SnapshotVersion.forDeletedDoc());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DeleteMutation other && hasSameKeyAndPrecondition(other);
    }

    @Override
    public int hashCode() {
        return keyAndPreconditionHashCode();
    }

    @Override
    public String toString() {
        return "DeleteMutation{key=" + getKey() + ", precondition=" + getPrecondition() + "}";
    }
}
