package com.williamcallahan.actdb.fixups;

/**
 * Signals that a fixup file exists but could not be read or parsed.
 */
public class FixupLoadException extends IllegalStateException {

    /**
     * Creates a fixup load exception with context and root cause.
     *
     * @param message which file failed
     * @param cause the underlying failure
     */
    public FixupLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
