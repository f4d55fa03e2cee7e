package com.sparrowwallet.vortex;

/**
 * Root of the checked exceptions raised by the session engine. Messages never carry key material.
 */
public class VortexException extends Exception {
    public VortexException(String message) {
        super(message);
    }

    public VortexException(String message, Throwable cause) {
        super(message, cause);
    }
}
