package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.DocumentKey;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@link TransformOperation}s on specific fields of an existing document.
 * <p>
 * Like a patch, it has no effect on a missing document. Its precondition is always
 * {@code exists(true)}: it is only ever sent after a set or patch in the same batch,
 * which leaves an existing document when it succeeds.
 * </p>
 */
public final class TransformMutation extends Mutation {

    private final List<FieldTransform> fieldTransforms;

    public TransformMutation(DocumentKey key, List<FieldTransform> fieldTransforms) {
        super(key, Precondition.exists(true));
        this.fieldTransforms = List.copyOf(fieldTransforms);
    }

    public List<FieldTransform> getFieldTransforms() {
        return fieldTransforms;
    }

    @Override
    public MutationType getType() {
        return MutationType.TRANSFORM;
    }

    @Override
    public MaybeDocument applyToRemoteDocument(MaybeDocument maybeDoc, MutationResult mutationResult) {
        verifyKeyMatches(maybeDoc);

        List<FieldValue> transformResults = mutationResult.transformResults();
        Assert.hardAssert(transformResults != null, "Transform results missing for TransformMutation.");
        Assert.hardAssert(transformResults.size() == fieldTransforms.size(),
                "TransformResults length mismatch (expected %s, got %s).",
                fieldTransforms.size(), transformResults.size());

        // See PatchMutation: without a cached document there is nothing to transform.
        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        Document doc = requireDocument(maybeDoc);
        ObjectValue data = doc.getData();
        for (int i = 0; i < fieldTransforms.size(); i++) {
            FieldTransform fieldTransform = fieldTransforms.get(i);
            FieldValue previousValue = data.field(fieldTransform.fieldPath());
            FieldValue newValue = fieldTransform.operation()
                    .applyToRemoteDocument(previousValue, transformResults.get(i));
            data = data.set(fieldTransform.fieldPath(), newValue);
        }
        return new Document(getKey(), doc.getVersion(), data, false);
    }

    @Override
    public MaybeDocument applyToLocalView(MaybeDocument maybeDoc, MaybeDocument baseDoc, Timestamp localWriteTime) {
        verifyKeyMatches(maybeDoc);

        if (!getPrecondition().isValidFor(maybeDoc)) {
            return maybeDoc;
        }

        Document doc = requireDocument(maybeDoc);
        List<FieldValue> transformResults = localTransformResults(localWriteTime, baseDoc);
        ObjectValue data = doc.getData();
        for (int i = 0; i < fieldTransforms.size(); i++) {
            data = data.set(fieldTransforms.get(i).fieldPath(), transformResults.get(i));
        }
        return new Document(getKey(), doc.getVersion(), data, true);
    }

    /**
     * Casts {@code maybeDoc} to a {@link Document}. The exists precondition has been
     * checked by the caller, so anything else is a broken invariant.
     */
    private Document requireDocument(MaybeDocument maybeDoc) {
        if (!(maybeDoc instanceof Document doc)) {
            throw Assert.fail("Unknown MaybeDocument type %s", maybeDoc);
        }
        Assert.hardAssert(doc.getKey().equals(getKey()), "Can only transform a document with the same key");
        return doc;
    }

    /**
     * Estimates one result per field transform. Previous values come from the document
     * as it was before the batch, not from the view being mutated.
     */
    private List<FieldValue> localTransformResults(Timestamp localWriteTime, MaybeDocument baseDoc) {
        List<FieldValue> results = new ArrayList<>(fieldTransforms.size());
        for (FieldTransform fieldTransform : fieldTransforms) {
            FieldValue previousValue = null;
            if (baseDoc instanceof Document base) {
                previousValue = base.field(fieldTransform.fieldPath());
            }
            results.add(fieldTransform.operation().applyToLocalView(previousValue, localWriteTime));
        }
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TransformMutation other
                && hasSameKeyAndPrecondition(other)
                && fieldTransforms.equals(other.fieldTransforms);
    }

    @Override
    public int hashCode() {
        return 31 * keyAndPreconditionHashCode() + fieldTransforms.hashCode();
    }

    @Override
    public String toString() {
        return "TransformMutation{key=" + getKey() + ", transforms=" + fieldTransforms + "}";
    }
}
