package com.project.pvb.crypto;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;
import java.util.Objects;

public class Ed25519DeviceSigner implements DeviceSigner {

    private final Ed25519PrivateKeyParameters privateKey;

    public Ed25519DeviceSigner(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey must not be null");
    }

    public static Ed25519DeviceSigner generate() {
        return new Ed25519DeviceSigner(new Ed25519PrivateKeyParameters(new SecureRandom()));
    }

    public static Ed25519DeviceSigner fromSeed(byte[] seed) {
        return new Ed25519DeviceSigner(new Ed25519PrivateKeyParameters(seed, 0));
    }

    @Override
    public SignatureScheme scheme() {
        return SignatureScheme.ED25519;
    }

    @Override
    public byte[] publicKey() {
        return privateKey.generatePublicKey().getEncoded();
    }

    @Override
    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }
}
