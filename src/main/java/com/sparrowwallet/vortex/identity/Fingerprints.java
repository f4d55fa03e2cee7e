package com.sparrowwallet.vortex.identity;

import com.sparrowwallet.vortex.crypto.RatchetHash;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.StringJoiner;

/**
 * Human comparable renderings of identity keys.
 */
public class Fingerprints {
    public static final int FINGERPRINT_GROUPS = 8;
    public static final int SAFETY_NUMBER_GROUPS = 6;

    private final RatchetHash hash;

    public Fingerprints(RatchetHash hash) {
        this.hash = hash;
    }

    /**
     * The first eight groups of four lowercase hex characters of the hash of the identity public key, separated by
     * spaces.
     */
    public String fingerprint(byte[] identityPublicKey) {
        String hex = HexFormat.of().formatHex(hash.hash(identityPublicKey));
        StringJoiner joiner = new StringJoiner(" ");
        for(int i = 0; i < FINGERPRINT_GROUPS; i++) {
            joiner.add(hex.substring(i * 4, i * 4 + 4));
        }

        return joiner.toString();
    }

    /**
     * Computes a safety number for a pair of identity keys that does not depend on which party computes it. The keys
     * are concatenated smaller first in unsigned lexicographic order and hashed. Each of the six groups is a
     * five byte big endian window of the hash, reduced modulo 100000 and zero padded to five digits.
     */
    public String safetyNumber(byte[] ourIdentityKey, byte[] theirIdentityKey) {
        byte[] first = ourIdentityKey;
        byte[] second = theirIdentityKey;
        if(Arrays.compareUnsigned(ourIdentityKey, theirIdentityKey) > 0) {
            first = theirIdentityKey;
            second = ourIdentityKey;
        }

        byte[] digest = hash.hash(first, second);
        StringJoiner joiner = new StringJoiner(" ");
        for(int i = 0; i < SAFETY_NUMBER_GROUPS; i++) {
            long chunk = 0;
            for(int j = 0; j < 5; j++) {
                chunk = (chunk << 8) | (digest[i * 5 + j] & 0xff);
            }
            joiner.add(String.format("%05d", chunk % 100000));
        }

        return joiner.toString();
    }
}
