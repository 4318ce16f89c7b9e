package com.nayem.strata.mutation;

import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.ServerTimestampValue;

/** Sets a field to the time the backend commits the write. */
public enum ServerTimestampTransform implements TransformOperation {
    INSTANCE;

    @Override
    public FieldValue applyToLocalView(FieldValue previousValue, Timestamp localWriteTime) {
        return new ServerTimestampValue(localWriteTime, previousValue);
    }

    @Override
    public FieldValue applyToRemoteDocument(FieldValue previousValue, FieldValue transformResult) {
        return transformResult;
    }
}
