package com.nayem.strata.model;

import java.util.Objects;

/** A document known not to exist at the given version. */
public final class NoDocument extends MaybeDocument {

    public NoDocument(DocumentKey key, SnapshotVersion version) {
        super(key, version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NoDocument other
                && getKey().equals(other.getKey())
                && getVersion().equals(other.getVersion());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getVersion());
    }

    @Override
    public String toString() {
        return "NoDocument{key=" + getKey() + ", version=" + getVersion() + "}";
    }
}
