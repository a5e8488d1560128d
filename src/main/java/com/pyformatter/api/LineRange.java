package com.pyformatter.api;

import java.util.Objects;

/**
 * An inclusive, 1-based range of source lines to confine formatting to.
 */
public final class LineRange {
    private final int start;
    private final int end;

    public LineRange(int start, int end) {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("Invalid line range " + start + "-" + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Parses {@code START-END}.
     */
    public static LineRange parse(String text) {
        String[] parts = text.trim().split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Line range must look like START-END: " + text);
        }
        try {
            return new LineRange(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line range must look like START-END: " + text, e);
        }
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean intersects(int first, int last) {
        return first <= end && last >= start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineRange)) {
            return false;
        }
        LineRange other = (LineRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
