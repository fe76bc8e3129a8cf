package de.bsommerfeld.nestedsets.core.error;

/**
 * Thrown when the storage layer gave up waiting for a lock or detected a
 * deadlock. Callers may retry: every operation re-reads fresh boundaries.
 */
public class ConcurrencyConflictException extends NestedSetException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
