package com.nayem.strata.model;

import com.nayem.strata.model.value.FieldValue;
import com.nayem.strata.model.value.ObjectValue;
import com.nayem.strata.model.value.ServerTimestampBehavior;

import java.util.Objects;

/**
 * A document that exists, with its field data.
 */
public final class Document extends MaybeDocument {

    private final ObjectValue data;
    private final boolean hasLocalMutations;

    public Document(DocumentKey key, SnapshotVersion version, ObjectValue data, boolean hasLocalMutations) {
        super(key, version);
        this.data = Objects.requireNonNull(data, "data");
        this.hasLocalMutations = hasLocalMutations;
    }

    public ObjectValue getData() {
        return data;
    }

    /**
     * Whether this view contains writes the backend has not acknowledged yet.
     */
    public boolean hasLocalMutations() {
        return hasLocalMutations;
    }

    /** Returns the value at {@code path}, or null if the document has no such field. */
    public FieldValue field(FieldPath path) {
        return data.field(path);
    }

    /**
     * Returns the plain Java value at {@code path}, resolving pending server
     * timestamps with {@code behavior}.
     */
    public Object getFieldValue(FieldPath path, ServerTimestampBehavior behavior) {
        FieldValue value = field(path);
        return value == null ? null : value.value(behavior);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Document other)) {
            return false;
        }
        return getKey().equals(other.getKey())
                && getVersion().equals(other.getVersion())
                && hasLocalMutations == other.hasLocalMutations
                && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getVersion(), data, hasLocalMutations);
    }

    @Override
    public String toString() {
        return "Document{key=" + getKey() + ", version=" + getVersion() + ", data=" + data
                + ", hasLocalMutations=" + hasLocalMutations + "}";
    }
}
