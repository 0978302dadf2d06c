package com.williamcallahan.actdb.structure;

/**
 * Half-open index range {@code [start, end)} into a list of act children. A degenerate range
 * ({@code start == end}) is a splice point.
 *
 * @param start first index of the range
 * @param end index after the last element of the range
 */
public record CutPoints(int start, int end) {

    public CutPoints {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid cut points: (" + start + ", " + end + ")");
        }
    }

    public boolean isInsertionPoint() {
        return start == end;
    }

    CutPoints offset(int by) {
        return new CutPoints(start + by, end + by);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
