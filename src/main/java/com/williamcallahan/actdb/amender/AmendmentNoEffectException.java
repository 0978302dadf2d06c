package com.williamcallahan.actdb.amender;

/**
 * Signals that applying a modification touched no element of the act.
 *
 * <p>Every extracted modification must apply somewhere, so this is evidence of an inconsistency in
 * the source acts or a modification that was already applied.</p>
 */
public class AmendmentNoEffectException extends RuntimeException {

    /**
     * Creates an exception naming the modification that had no effect.
     *
     * @param message which modification and where
     */
    public AmendmentNoEffectException(String message) {
        super(message);
    }
}
