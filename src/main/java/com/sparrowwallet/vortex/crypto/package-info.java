/**
 * Provides interfaces and concrete implementations of the cryptographic primitives used by the ratchet engine (key
 * agreement, AEAD ciphers, hashing and key derivation, signatures, and password hashing). Nothing outside this
 * package touches a JCA or BouncyCastle API directly.
 */
package com.sparrowwallet.vortex.crypto;
