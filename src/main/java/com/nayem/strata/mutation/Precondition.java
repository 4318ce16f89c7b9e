package com.nayem.strata.mutation;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.NoDocument;
import com.nayem.strata.model.SnapshotVersion;
import com.nayem.strata.util.Assert;

import java.util.Objects;

/**
 * A guard on when a mutation may take effect, mirroring what the backend accepts:
 * either an {@code exists} flag, or an {@code updateTime} the document must be at,
 * or {@link #NONE}. Never both.
 */
public final class Precondition {

    public static final Precondition NONE = new Precondition(null, null);

    private final SnapshotVersion updateTime;
    private final Boolean exists;

    private Precondition(SnapshotVersion updateTime, Boolean exists) {
        Assert.hardAssert(updateTime == null || exists == null,
                "Precondition can specify \"exists\" or \"updateTime\" but not both");
        this.updateTime = updateTime;
        this.exists = exists;
    }

    /** Creates a precondition on whether the document exists. */
    public static Precondition exists(boolean exists) {
        return new Precondition(null, exists);
    }

    /** Creates a precondition that the document exists at exactly {@code version}. */
    public static Precondition updateTime(SnapshotVersion version) {
        return new Precondition(Objects.requireNonNull(version, "version"), null);
    }

    public boolean isNone() {
        return updateTime == null && exists == null;
    }

    /** The required update time, or null. */
    public SnapshotVersion getUpdateTime() {
        return updateTime;
    }

    /** The required existence, or null. */
    public Boolean getExists() {
        return exists;
    }

    /**
     * Returns whether this precondition holds for {@code maybeDoc}, which is null when
     * nothing is known about the document.
     */
    public boolean isValidFor(MaybeDocument maybeDoc) {
        if (updateTime != null) {
            return maybeDoc instanceof Document && maybeDoc.getVersion().equals(updateTime);
        } else if (exists != null) {
            if (exists) {
                return maybeDoc instanceof Document;
            }
            return maybeDoc == null || maybeDoc instanceof NoDocument;
        }
        Assert.hardAssert(isNone(), "Precondition should be empty");
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Precondition other)) {
            return false;
        }
        return Objects.equals(updateTime, other.updateTime) && Objects.equals(exists, other.exists);
    }

    @Override
    public int hashCode() {
        return Objects.hash(updateTime, exists);
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "Precondition{<none>}";
        } else if (updateTime != null) {
            return "Precondition{updateTime=" + updateTime + "}";
        }
        return "Precondition{exists=" + exists + "}";
    }
}
