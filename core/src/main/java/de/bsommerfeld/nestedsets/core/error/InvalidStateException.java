package de.bsommerfeld.nestedsets.core.error;

/**
 * Thrown when stored rows break the nested set invariants, so no further
 * structural change can be planned on top of them.
 */
public class InvalidStateException extends NestedSetException {

    public InvalidStateException(String message) {
        super(message);
    }
}
