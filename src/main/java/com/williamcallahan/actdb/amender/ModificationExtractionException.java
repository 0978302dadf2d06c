package com.williamcallahan.actdb.amender;

/**
 * Signals that an act's amending provisions are inconsistent, e.g. a block-amendment container
 * whose phrase does not introduce a block amendment.
 */
public class ModificationExtractionException extends IllegalStateException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message failure summary
     */
    public ModificationExtractionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public ModificationExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
