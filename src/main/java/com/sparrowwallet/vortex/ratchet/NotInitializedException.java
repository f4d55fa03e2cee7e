package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when a session is used before its handshake has completed, or asked to encrypt before its sending chain
 * exists.
 */
public class NotInitializedException extends VortexException {
    public NotInitializedException(String message) {
        super(message);
    }

    public NotInitializedException(String message, Throwable cause) {
        super(message, cause);
    }
}
