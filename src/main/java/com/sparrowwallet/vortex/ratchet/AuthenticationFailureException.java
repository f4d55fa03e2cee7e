package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when a message cannot be authenticated: an AEAD tag mismatch, an invalid ratchet key, or a message whose key
 * has already been consumed. The session is left exactly as it was before the call.
 */
public class AuthenticationFailureException extends VortexException {
    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
