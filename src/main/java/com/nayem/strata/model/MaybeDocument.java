package com.nayem.strata.model;

import java.util.Objects;

/**
 * What the client knows about a document: either it exists ({@link Document}) or it
 * is known not to exist ({@link NoDocument}). Having no knowledge at all is
 * represented by {@code null} wherever a {@code MaybeDocument} is accepted.
 * <p>
 * These two subclasses are the only ones; the constructor is package-private.
 * </p>
 */
public abstract class MaybeDocument {

    private final DocumentKey key;
    private final SnapshotVersion version;

    MaybeDocument(DocumentKey key, SnapshotVersion version) {
        this.key = Objects.requireNonNull(key, "key");
        this.version = Objects.requireNonNull(version, "version");
    }

    public DocumentKey getKey() {
        return key;
    }

    /** The version at which this document was last read or written. */
    public SnapshotVersion getVersion() {
        return version;
    }
}
