package com.nayem.strata.model.value;

/**
 * How a pending server timestamp reads before the backend has assigned it.
 */
public enum ServerTimestampBehavior {
    /** Read as null. */
    NONE,
    /** Read as the local time of the write. */
    ESTIMATE,
    /** Read as the value the field had before the write, or null. */
    PREVIOUS
}
