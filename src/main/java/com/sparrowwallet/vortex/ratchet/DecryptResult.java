package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.protocol.MessageHeader;

/**
 * A decrypted message together with how the session processed it.
 */
public record DecryptResult(byte[] plaintext, Kind kind, MessageHeader header) {
    public boolean isRatchetStep() {
        return kind == Kind.RATCHET_STEP;
    }

    public enum Kind {
        /**
         * The next message of the current receiving chain, or a later one with earlier keys cached as skipped.
         */
        IN_ORDER,
        /**
         * A message whose key had been cached as skipped.
         */
        OUT_OF_ORDER,
        /**
         * The message carried a new ratchet key and the session performed a DH ratchet step.
         */
        RATCHET_STEP
    }
}
