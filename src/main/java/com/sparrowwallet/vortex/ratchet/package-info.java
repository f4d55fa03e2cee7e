/**
 * X3DH session setup and the header-keyed Double Ratchet.
 */
package com.sparrowwallet.vortex.ratchet;
