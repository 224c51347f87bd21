package com.example.musictaste.domain.model;

import java.util.Objects;

/**
 * Inclusive range of release years, e.g. {@code {1990, 1999}}.
 */
public final class EraRange {

    private final int start;
    private final int end;

    public EraRange(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("era start must be <= end, got " + start + ">" + end);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean contains(int year) {
        return year >= start && year <= end;
    }

    public double midpoint() {
        return (start + end) / 2.0D;
    }

    public double halfRange() {
        return (end - start) / 2.0D;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EraRange)) {
            return false;
        }
        EraRange other = (EraRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "{" + start + "," + end + "}";
    }
}
