package com.flowhouse.query;

/**
 * Inclusive query time range in epoch seconds
 */
public class TimeRange {
    private final long start;
    private final long end;

    public TimeRange(long start, long end) {
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
