package de.bsommerfeld.nestedsets.core.error;

/**
 * Thrown when a planned operation would push a boundary value beyond the
 * configured ceiling.
 */
public class BoundaryOverflowException extends NestedSetException {

    private final long requested;
    private final long ceiling;

    public BoundaryOverflowException(long requested, long ceiling) {
        super("Boundary " + requested + " exceeds the maximum of " + ceiling);
        this.requested = requested;
        this.ceiling = ceiling;
    }

    public long getRequested() {
        return requested;
    }

    public long getCeiling() {
        return ceiling;
    }
}
