package de.bsommerfeld.nestedsets.core.error;

/**
 * Base type for every failure surfaced by a nested set tree. Whatever the
 * subtype, the transaction that raised it has been rolled back and the
 * stored boundaries are unchanged.
 */
public class NestedSetException extends RuntimeException {

    public NestedSetException(String message) {
        super(message);
    }

    public NestedSetException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether re-issuing the same call may succeed. Only storage-level lock
     * conflicts qualify.
     */
    public boolean isRetryable() {
        return false;
    }
}
