package com.williamcallahan.actdb.structure;

/**
 * Signals that a reference could not be mapped onto a position or range of an act.
 *
 * <p>Fatal to the single modification being applied. The message names the level that failed so
 * malformed source amendments can be diagnosed.</p>
 */
public class ReferenceResolutionException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message which reference level could not be resolved
     */
    public ReferenceResolutionException(String message) {
        super(message);
    }

    /**
     * Creates an exception wrapping a failure of a narrower resolution step.
     *
     * @param message which reference level could not be resolved
     * @param cause failure of the narrower step
     */
    public ReferenceResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
