package com.project.pvb.crypto;

/**
 * Signing half of a device key pair, as held by a Device Security Module.
 */
public interface DeviceSigner {

    SignatureScheme scheme();

    /**
     * Public key bytes in the encoding the matching {@link SignatureVerifier} expects.
     */
    byte[] publicKey();

    byte[] sign(byte[] message);
}
