package com.sparrowwallet.vortex.protocol;

/**
 * A unit that travels between peers inside a typed envelope.
 */
public interface WireMessage {
    MessageKind getKind();
}
