open module com.sparrowwallet.vortex {
    requires org.bouncycastle.provider;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;
    exports com.sparrowwallet.vortex;
    exports com.sparrowwallet.vortex.crypto;
    exports com.sparrowwallet.vortex.identity;
    exports com.sparrowwallet.vortex.protocol;
    exports com.sparrowwallet.vortex.ratchet;
}
