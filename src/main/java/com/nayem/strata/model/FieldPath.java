package com.nayem.strata.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A path to a field inside a document, e.g. {@code address.city}.
 */
public final class FieldPath implements Comparable<FieldPath> {

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A field path needs at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Invalid field path segment in " + segments);
            }
        }
        this.segments = List.copyOf(segments);
    }

    public static FieldPath of(String... segments) {
        return new FieldPath(Arrays.asList(segments));
    }

    public static FieldPath of(List<String> segments) {
        return new FieldPath(segments);
    }

    /**
     * Parses a dotted path such as {@code "a.b.c"}. Dots always separate segments;
     * use {@link #of(String...)} for names that contain dots.
     */
    public static FieldPath fromDotSeparatedPath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        return new FieldPath(Arrays.asList(path.split("\\.", -1)));
    }

    public int length() {
        return segments.size();
    }

    public String getSegment(int index) {
        return segments.get(index);
    }

    public String getFirstSegment() {
        return segments.get(0);
    }

    public String getLastSegment() {
        return segments.get(segments.size() - 1);
    }

    public List<String> getSegments() {
        return segments;
    }

    /** Returns the path without its first segment, or null for a single-segment path. */
    public FieldPath popFirst() {
        return segments.size() == 1 ? null : new FieldPath(segments.subList(1, segments.size()));
    }

    public FieldPath append(String segment) {
        List<String> appended = new ArrayList<>(segments);
        appended.add(segment);
        return new FieldPath(appended);
    }

    public boolean isPrefixOf(FieldPath other) {
        return other.segments.size() >= segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    public String canonicalString() {
        return String.join(".", segments);
    }

    @Override
    public int compareTo(FieldPath other) {
        int limit = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < limit; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FieldPath other && segments.equals(other.segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return canonicalString();
    }
}
