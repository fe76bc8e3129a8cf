package de.bsommerfeld.nestedsets.core.error;

/**
 * Wraps a storage failure that is neither a missing node nor a lock conflict,
 * e.g. a broken connection or a malformed statement.
 */
public class StorageException extends NestedSetException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
