package com.libragraph.sift.core.ledger;

/**
 * Half-open byte range {@code [start, end)} in the coordinates of one data instance.
 */
public record Interval(long start, long end) implements Comparable<Interval> {

    public Interval {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid interval [" + start + ", " + end + ")");
        }
    }

    public long length() {
        return end - start;
    }

    public boolean overlaps(Interval other) {
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(Interval other) {
        int byStart = Long.compare(start, other.start);
        return byStart != 0 ? byStart : Long.compare(end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
