package de.bsommerfeld.nestedsets.core.boundary;

/**
 * Where a moved subtree lands relative to its target node.
 */
public enum MovePosition {

    /** Inside the target, after its existing children. */
    LAST_CHILD,
    /** Inside the target, before its existing children. */
    FIRST_CHILD,
    /** Immediately before the target, as its sibling. */
    BEFORE,
    /** Immediately after the target, as its sibling. */
    AFTER;

    /**
     * Returns the boundary value, in pre-move numbering, that the subtree's
     * {@code left} has to take.
     */
    public long insertionPoint(Boundaries target) {
        return switch (this) {
            case LAST_CHILD -> target.right();
            case FIRST_CHILD -> target.left() + 1;
            case BEFORE -> target.left();
            case AFTER -> target.right() + 1;
        };
    }
}
