package com.cleanbear.assignment.model;

import com.cleanbear.assignment.util.TimeFormats;

import java.util.Objects;

/**
 * Half-open interval [start, end) in minutes since midnight.
 */
public class TimeInterval implements Comparable<TimeInterval> {

    private final int start;
    private final int end;

    public TimeInterval(int start, int end) {
        if (end < start) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }

    /**
     * True when this interval intersects {@code other} widened by {@code bufferMin} on both sides.
     */
    public boolean overlaps(TimeInterval other, int bufferMin) {
        return start < other.end + bufferMin && other.start - bufferMin < end;
    }

    @Override
    public int compareTo(TimeInterval other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeInterval)) return false;
        TimeInterval that = (TimeInterval) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return TimeFormats.format(start) + "-" + TimeFormats.format(end);
    }
}
