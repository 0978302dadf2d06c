package com.williamcallahan.actdb.enforcement;

/**
 * Signals that the enforcement dates of an act could not be determined: a missing or duplicate
 * default date, an unsupported date kind, or an unresolvable position.
 */
public class EnforcementDateException extends IllegalStateException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message failure summary
     */
    public EnforcementDateException(String message) {
        super(message);
    }

    /**
     * Creates an exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public EnforcementDateException(String message, Throwable cause) {
        super(message, cause);
    }
}
