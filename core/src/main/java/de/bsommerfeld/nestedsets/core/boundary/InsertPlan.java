package de.bsommerfeld.nestedsets.core.boundary;

import java.util.List;

/**
 * Result of planning an insertion: where the new node(s) go and the shift
 * that opens room for them. The shift must be applied before the rows are
 * written.
 *
 * @param nodes boundaries of the inserted nodes, in insertion order
 * @param shift the gap-opening shift, {@link Shift#NONE} for a new root
 */
public record InsertPlan(List<Boundaries> nodes, Shift shift) {

    public InsertPlan {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("An insert plan needs at least one node");
        }
        nodes = List.copyOf(nodes);
    }

    public Boundaries first() {
        return nodes.get(0);
    }
}
