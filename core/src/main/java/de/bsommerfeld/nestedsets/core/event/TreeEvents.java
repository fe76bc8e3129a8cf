package de.bsommerfeld.nestedsets.core.event;

import de.bsommerfeld.nestedsets.core.boundary.Boundaries;

import java.util.List;

/**
 * Events posted on the {@link TreeEventBus} after a structural change has
 * been committed. They carry ids and boundaries only, never payloads.
 */
public class TreeEvents {

    /** Common shape of all tree events: the table whose tree changed. */
    public interface TreeEvent {
        String table();
    }

    /** One or more nodes were attached, in insertion order. */
    public record NodesInserted(String table, List<Long> nodeIds) implements TreeEvent {
    }

    /** A node and all its descendants were removed. */
    public record SubtreeDeleted(String table, long nodeId, Boundaries removed, List<Long> removedIds)
            implements TreeEvent {
    }

    public record SubtreeMoved(String table, long nodeId, Boundaries from, Boundaries to) implements TreeEvent {
    }
}
