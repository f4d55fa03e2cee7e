package com.sparrowwallet.vortex.protocol;

import com.sparrowwallet.vortex.VortexException;

public class InvalidWireFormatException extends VortexException {
    public InvalidWireFormatException(String message) {
        super(message);
    }

    public InvalidWireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
