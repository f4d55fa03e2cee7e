package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.VortexException;

/**
 * Raised when accepting a message would require deriving more skipped message keys than the configured bound. The
 * session is left unchanged.
 */
public class TooManySkippedMessagesException extends VortexException {
    public TooManySkippedMessagesException(String message) {
        super(message);
    }

    public TooManySkippedMessagesException(String message, Throwable cause) {
        super(message, cause);
    }
}
