package de.bsommerfeld.nestedsets.core.boundary;

/**
 * Result of planning a subtree removal. Rows whose boundaries fall inside
 * {@code removed} are deleted first, then {@code shift} closes the gap.
 */
public record DeletePlan(Boundaries removed, Shift shift) {

    /** Number of nodes that leave the forest. */
    public long removedNodes() {
        return removed.width() / 2;
    }
}
