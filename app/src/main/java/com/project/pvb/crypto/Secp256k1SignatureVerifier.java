package com.project.pvb.crypto;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Verifies recoverable secp256k1 signatures by recovering the signer's public key
 * from the signature and comparing it with the registered key.
 *
 * The message is signed as-is (no prefix, no re-hashing); for the ledger it is the
 * 32-byte data hash.
 */
public class Secp256k1SignatureVerifier implements SignatureVerifier {

    static final int SIGNATURE_LENGTH = 65;
    static final int PUBLIC_KEY_LENGTH = 64;

    @Override
    public boolean verify(byte[] message, byte[] signature, byte[] publicKey) {
        if (message == null || message.length != 32) {
            return false;
        }
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        byte[] expectedKey = normalizePublicKey(publicKey);
        if (expectedKey == null) {
            return false;
        }

        byte v = signature[64];
        if (v == 0 || v == 1) {
            v = (byte) (v + 27);
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64)
        );

        try {
            BigInteger recovered = Sign.signedMessageHashToKey(message, signatureData);
            return recovered.equals(Numeric.toBigInt(expectedKey));
        } catch (SignatureException | RuntimeException e) {
            // Unrecoverable signature means it was not produced by any key
            return false;
        }
    }

    /**
     * Accepts 64-byte {@code x||y} keys or 65-byte keys with the {@code 0x04} uncompressed prefix.
     *
     * @return the 64-byte {@code x||y} form, or {@code null} for any other shape
     */
    public static byte[] normalizePublicKey(byte[] publicKey) {
        if (publicKey == null) {
            return null;
        }
        if (publicKey.length == PUBLIC_KEY_LENGTH) {
            return publicKey;
        }
        if (publicKey.length == PUBLIC_KEY_LENGTH + 1 && publicKey[0] == 0x04) {
            return Arrays.copyOfRange(publicKey, 1, publicKey.length);
        }
        return null;
    }
}
