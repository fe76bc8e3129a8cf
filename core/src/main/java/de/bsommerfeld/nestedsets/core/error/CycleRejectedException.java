package de.bsommerfeld.nestedsets.core.error;

/**
 * Thrown when a move would place a subtree inside itself or one of its own
 * descendants.
 */
public class CycleRejectedException extends NestedSetException {

    public CycleRejectedException(String message) {
        super(message);
    }
}
