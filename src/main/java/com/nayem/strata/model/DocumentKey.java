package com.nayem.strata.model;

import java.util.List;

/**
 * Identifies a document by its slash-separated resource path, e.g.
 * {@code rooms/eros/messages/1}. A valid path has an even, non-zero number of
 * non-empty segments.
 */
public final class DocumentKey implements Comparable<DocumentKey> {

    private final List<String> segments;

    private DocumentKey(List<String> segments) {
        this.segments = segments;
    }

    public static DocumentKey fromPathString(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Document path must not be empty");
        }
        String[] parts = path.split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Invalid document path (empty segment): " + path);
            }
        }
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Invalid document path (odd number of segments, this points at a collection): " + path);
        }
        return new DocumentKey(List.of(parts));
    }

    public List<String> getSegments() {
        return segments;
    }

    /** Returns the id of the collection that directly contains this document. */
    public String getCollectionId() {
        return segments.get(segments.size() - 2);
    }

    public String getPath() {
        return String.join("/", segments);
    }

    @Override
    public int compareTo(DocumentKey other) {
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
        return this == o || (o instanceof DocumentKey other && segments.equals(other.segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return getPath();
    }
}
