package com.williamcallahan.actdb.persistence;

/**
 * Raised when a value cannot be stored in or loaded from the blob store.
 */
public class PersistenceException extends RuntimeException {

    /**
     * Creates a persistence exception with a message.
     *
     * @param message description of the failure
     */
    public PersistenceException(String message) {
        super(message);
    }

    /**
     * Creates a persistence exception with a message and cause.
     *
     * @param message description of the failure
     * @param cause underlying I/O or serialization failure
     */
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
