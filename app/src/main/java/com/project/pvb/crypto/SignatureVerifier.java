package com.project.pvb.crypto;

/**
 * Checks that a signature over a message was produced by the holder of a public key.
 * Malformed signatures or keys verify as {@code false}.
 */
@FunctionalInterface
public interface SignatureVerifier {
    boolean verify(byte[] message, byte[] signature, byte[] publicKey);
}
