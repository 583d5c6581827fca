package com.project.pvb.crypto;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * secp256k1 signer producing 65-byte {@code r||s||v} signatures over raw messages.
 */
public class Secp256k1DeviceSigner implements DeviceSigner {

    private final ECKeyPair keyPair;

    public Secp256k1DeviceSigner(ECKeyPair keyPair) {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair must not be null");
    }

    public static Secp256k1DeviceSigner generate() {
        try {
            return new Secp256k1DeviceSigner(Keys.createEcKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("secp256k1 key generation unavailable", e);
        }
    }

    public static Secp256k1DeviceSigner fromPrivateKey(String privateKeyHex) {
        return new Secp256k1DeviceSigner(ECKeyPair.create(Numeric.toBigInt(privateKeyHex)));
    }

    @Override
    public SignatureScheme scheme() {
        return SignatureScheme.SECP256K1;
    }

    @Override
    public byte[] publicKey() {
        return Numeric.toBytesPadded(keyPair.getPublicKey(), Secp256k1SignatureVerifier.PUBLIC_KEY_LENGTH);
    }

    public BigInteger privateKey() {
        return keyPair.getPrivateKey();
    }

    @Override
    public byte[] sign(byte[] message) {
        Sign.SignatureData data = Sign.signMessage(message, keyPair, false);
        byte[] signature = new byte[Secp256k1SignatureVerifier.SIGNATURE_LENGTH];
        System.arraycopy(data.getR(), 0, signature, 0, 32);
        System.arraycopy(data.getS(), 0, signature, 32, 32);
        signature[64] = data.getV()[0];
        return signature;
    }
}
