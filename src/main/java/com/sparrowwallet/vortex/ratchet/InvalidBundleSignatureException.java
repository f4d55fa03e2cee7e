package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when a session is requested against a pre-key bundle whose signed pre-key signature does not verify.
 */
public class InvalidBundleSignatureException extends VortexException {
    public InvalidBundleSignatureException(String message) {
        super(message);
    }

    public InvalidBundleSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
