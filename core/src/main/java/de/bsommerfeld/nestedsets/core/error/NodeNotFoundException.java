package de.bsommerfeld.nestedsets.core.error;

/**
 * Thrown when a referenced node does not exist, including nodes removed by an
 * earlier subtree deletion.
 */
public class NodeNotFoundException extends NestedSetException {

    private final long nodeId;

    public NodeNotFoundException(long nodeId) {
        super("Node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public long getNodeId() {
        return nodeId;
    }
}
