package io.fullerstack.csms.store;

/**
 * Thrown when the persistence collaborator fails to read or write a record.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
