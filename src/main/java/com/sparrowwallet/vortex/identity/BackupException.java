package com.sparrowwallet.vortex.identity;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when an identity backup cannot be restored. All reasons are permanent for a given input.
 */
public class BackupException extends VortexException {
    private final Reason reason;

    public BackupException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BackupException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        UNSUPPORTED_VERSION, AUTHENTICATION_FAILURE, MALFORMED
    }
}
