package com.williamcallahan.actdb.amender;

/**
 * Signals that a modification could not be applied because the act's content does not fit it,
 * e.g. replacement elements of the wrong kind or a broken identifier order afterwards.
 */
public class AmendmentApplicationException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message failure summary
     */
    public AmendmentApplicationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public AmendmentApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
