package com.sparrowwallet.vortex.ratchet;

public enum Role {
    INITIATOR, RESPONDER
}
