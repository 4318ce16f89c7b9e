package com.nayem.strata.model;

import java.util.Objects;

/**
 * A version of a document as assigned by the backend.
 * <p>
 * Two sentinels stand for "no real server version": {@link #MIN}, used for confirmed
 * deletes and for documents that never existed, and {@link #forDeletedDoc()}, the
 * version of a tombstone written by a local delete that the server has not confirmed
 * yet. They are never equal. The tombstone sorts directly after {@code MIN} and before
 * every real version.
 * </p>
 */
public final class SnapshotVersion implements Comparable<SnapshotVersion> {

    public static final SnapshotVersion MIN = new SnapshotVersion(new Timestamp(0, 0), false);

    private static final SnapshotVersion LOCAL_TOMBSTONE = new SnapshotVersion(new Timestamp(0, 0), true);

    private final Timestamp timestamp;
    private final boolean localTombstone;

    private SnapshotVersion(Timestamp timestamp, boolean localTombstone) {
        this.timestamp = timestamp;
        this.localTombstone = localTombstone;
    }

    public static SnapshotVersion of(Timestamp timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        return new SnapshotVersion(timestamp, false);
    }

    /**
     * Returns the version stamped on documents deleted locally and not yet
     * acknowledged by the backend.
     */
    public static SnapshotVersion forDeletedDoc() {
        return LOCAL_TOMBSTONE;
    }

    public Timestamp getTimestamp() {
        return timestamp;
    }

    public boolean isLocalTombstone() {
        return localTombstone;
    }

    @Override
    public int compareTo(SnapshotVersion other) {
        int cmp = timestamp.compareTo(other.timestamp);
        return cmp != 0 ? cmp : Boolean.compare(localTombstone, other.localTombstone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SnapshotVersion other)) {
            return false;
        }
        return localTombstone == other.localTombstone && timestamp.equals(other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, localTombstone);
    }

    @Override
    public String toString() {
        if (localTombstone) {
            return "SnapshotVersion(local tombstone)";
        }
        return "SnapshotVersion(" + timestamp + ")";
    }
}
