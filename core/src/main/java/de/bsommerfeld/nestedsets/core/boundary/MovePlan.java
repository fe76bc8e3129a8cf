package de.bsommerfeld.nestedsets.core.boundary;

/**
 * Result of planning a subtree move. Applied in four steps inside one
 * transaction:
 * <ol>
 * <li>park the rows in {@code origin} by negating their boundaries, which
 * takes them out of reach of the following shifts</li>
 * <li>apply {@code closeGap} to the remaining rows</li>
 * <li>apply {@code openGap} to the remaining rows</li>
 * <li>restore the parked rows as {@code -boundary + offset}</li>
 * </ol>
 *
 * @param origin   the subtree's boundaries before the move
 * @param closeGap shift that removes the hole left at the origin
 * @param openGap  shift that creates the hole at the destination
 * @param offset   constant added to every boundary of the moved subtree
 */
public record MovePlan(Boundaries origin, Shift closeGap, Shift openGap, long offset) {

    /** The subtree's boundaries once all four steps have run. */
    public Boundaries destination() {
        return origin.offset(offset);
    }

    /** True if the subtree ends up exactly where it started. */
    public boolean isNoop() {
        return offset == 0;
    }
}
