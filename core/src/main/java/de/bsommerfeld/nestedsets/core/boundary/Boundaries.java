package de.bsommerfeld.nestedsets.core.boundary;

/**
 * The {@code (left, right)} pair of a single node. Both values are positive
 * and {@code left < right}; the interval is inclusive on both ends.
 */
public record Boundaries(long left, long right) {

    public Boundaries {
        if (left < 1 || right <= left) {
            throw new IllegalArgumentException("Invalid boundaries (" + left + ", " + right + ")");
        }
    }

    /** Number of boundary values the interval occupies, {@code right - left + 1}. */
    public long width() {
        return right - left + 1;
    }

    /** Descendant count implied by the width identity. */
    public long descendantCount() {
        return (width() - 2) / 2;
    }

    /** True if {@code value} lies in {@code [left, right]}. */
    public boolean covers(long value) {
        return left <= value && value <= right;
    }

    /** True if {@code other} sits strictly inside this interval. */
    public boolean strictlyContains(Boundaries other) {
        return left < other.left && other.right < right;
    }

    /** True if {@code other} equals or sits inside this interval. */
    public boolean containsOrEquals(Boundaries other) {
        return left <= other.left && other.right <= right;
    }

    public Boundaries offset(long delta) {
        return new Boundaries(left + delta, right + delta);
    }

    @Override
    public String toString() {
        return "(" + left + "," + right + ")";
    }
}
