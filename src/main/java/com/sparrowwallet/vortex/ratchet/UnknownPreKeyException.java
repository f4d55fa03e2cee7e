package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when an incoming handshake references a pre-key that the local identity does not hold, no longer holds or has
 * already consumed.
 */
public class UnknownPreKeyException extends VortexException {
    public UnknownPreKeyException(String message) {
        super(message);
    }

    public UnknownPreKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
