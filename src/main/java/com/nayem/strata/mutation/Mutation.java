package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.SnapshotVersion;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.util.Assert;

import java.util.Objects;

/**
 * A self-contained write to one document: create, replace, patch, transform or
 * delete.
 * <p>
 * A mutation changes both the data and the version of a document. Set, patch and
 * transform keep the version of an existing document; delete resets it. The expected
 * transitions are:
 * </p>
 *
 * <pre>
 * MUTATION           APPLIED TO            RESULTS IN
 * SetMutation        Document(v3)          Document(v3)
 * SetMutation        NoDocument(v3)        Document(v0)
 * SetMutation        null                  Document(v0)
 * PatchMutation      Document(v3)          Document(v3)
 * PatchMutation      NoDocument(v3)        NoDocument(v3)
 * PatchMutation      null                  null
 * TransformMutation  Document(v3)          Document(v3)
 * TransformMutation  NoDocument(v3)        NoDocument(v3)
 * TransformMutation  null                  null
 * DeleteMutation     Document(v3)          NoDocument(v0)
 * DeleteMutation     NoDocument(v3)        NoDocument(v0)
 * DeleteMutation     null                  NoDocument(v0)
 * </pre>
 *
 * <p>
 * A local delete yields the {@link SnapshotVersion#forDeletedDoc() tombstone version}
 * instead of v0. Transform mutations never create a document, even though the backend
 * would: the client always sends them after a set or patch in the same batch and only
 * wants the transform applied when that write produced a document.
 * </p>
 * <p>
 * When a precondition does not hold the input document is returned as is; that is an
 * expected outcome, not an error. Broken invariants (wrong key, malformed results)
 * throw {@link com.nayem.strata.util.InvariantViolationException}.
 * </p>
 * <p>
 * The four subclasses in this package are the only mutation kinds.
 * </p>
 */
public abstract class Mutation {

    private final DocumentKey key;
    private final Precondition precondition;

    Mutation(DocumentKey key, Precondition precondition) {
        this.key = Objects.requireNonNull(key, "key");
        this.precondition = Objects.requireNonNull(precondition, "precondition");
    }

    public DocumentKey getKey() {
        return key;
    }

    public Precondition getPrecondition() {
        return precondition;
    }

    public abstract MutationType getType();

    /**
     * Applies this mutation to compute the document after the backend accepted it.
     *
     * @param maybeDoc       the document to mutate, or null if the client knows nothing
     *                       about it
     * @param mutationResult the backend's acknowledgement
     * @return the mutated document; null only if {@code maybeDoc} was null and the
     *         mutation does not create documents
     */
    public abstract MaybeDocument applyToRemoteDocument(MaybeDocument maybeDoc, MutationResult mutationResult);

    /**
     * Applies this mutation to compute the optimistic local view of the document.
     *
     * @param maybeDoc       the document to mutate, or null if the client knows nothing
     *                       about it
     * @param baseDoc        the document as it was before this mutation's batch, or null
     * @param localWriteTime the local time of the batch this mutation belongs to
     * @return the mutated document; null only if {@code maybeDoc} was null and the
     *         mutation does not create documents
     */
    public abstract MaybeDocument applyToLocalView(MaybeDocument maybeDoc, MaybeDocument baseDoc,
            Timestamp localWriteTime);

    protected void verifyKeyMatches(MaybeDocument maybeDoc) {
        if (maybeDoc != null) {
            Assert.hardAssert(maybeDoc.getKey().equals(key),
                    "Can only apply a mutation to a document with the same key (mutation: %s, document: %s)",
                    key, maybeDoc.getKey());
        }
    }

    /**
     * Returns the version of {@code maybeDoc} if it is an existing document, otherwise
     * {@link SnapshotVersion#MIN}.
     */
    protected static SnapshotVersion getPostMutationVersion(MaybeDocument maybeDoc) {
        if (maybeDoc instanceof Document) {
            return maybeDoc.getVersion();
        }
        return SnapshotVersion.MIN;
    }

    boolean hasSameKeyAndPrecondition(Mutation other) {
        return key.equals(other.key) && precondition.equals(other.precondition);
    }

    int keyAndPreconditionHashCode() {
        return 31 * key.hashCode() + precondition.hashCode();
    }
}
