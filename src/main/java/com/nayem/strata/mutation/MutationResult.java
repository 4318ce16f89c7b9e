package com.nayem.strata.mutation;

import com.nayem.strata.model.SnapshotVersion;
import com.nayem.strata.model.value.FieldValue;

import java.util.List;

/**
 * The backend's acknowledgement of one mutation.
 *
 * @param version          the commit version, or null for a delete
 * @param transformResults one value per {@link FieldTransform}, in order, for a
 *                         {@link TransformMutation}; null for every other kind
 */
public record MutationResult(SnapshotVersion version, List<FieldValue> transformResults) {

    public MutationResult {
        if (transformResults != null) {
            transformResults = List.copyOf(transformResults);
        }
    }

    /** Result of a set, patch or delete. */
    public static MutationResult of(SnapshotVersion version) {
        return new MutationResult(version, null);
    }
}
