package org.dxworks.cteframe.model;

import java.util.Objects;

/**
 * Half-open {@code [start, end)} character range into the original document.
 * Never used for offsets into generated SQL.
 */
public final class SourceRange {

    private final int start;
    private final int end;

    public SourceRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static SourceRange of(int start, int end) {
        return new SourceRange(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * Smallest range covering both this range and {@code other}.
     */
    public SourceRange union(SourceRange other) {
        return new SourceRange(Math.min(start, other.start), Math.max(end, other.end));
    }

    public String substring(String document) {
        return document.substring(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange that = (SourceRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
