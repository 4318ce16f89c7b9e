package com.nayem.strata.model;

import java.time.Instant;

/**
 * A point in time with nanosecond precision, independent of any time zone.
 *
 * @param seconds     seconds since the Unix epoch
 * @param nanoseconds non-negative fraction of a second, in {@code [0, 999_999_999]}
 */
public record Timestamp(long seconds, int nanoseconds) implements Comparable<Timestamp> {

    public Timestamp {
        if (nanoseconds < 0 || nanoseconds > 999_999_999) {
            throw new IllegalArgumentException("Timestamp nanoseconds out of range: " + nanoseconds);
        }
    }

    public static Timestamp now() {
        return ofInstant(Instant.now());
    }

    public static Timestamp ofInstant(Instant instant) {
        return new Timestamp(instant.getEpochSecond(), instant.getNano());
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanoseconds);
    }

    @Override
    public int compareTo(Timestamp other) {
        int cmp = Long.compare(seconds, other.seconds);
        return cmp != 0 ? cmp : Integer.compare(nanoseconds, other.nanoseconds);
    }

    @Override
    public String toString() {
        return "Timestamp(seconds=" + seconds + ", nanoseconds=" + nanoseconds + ")";
    }
}
