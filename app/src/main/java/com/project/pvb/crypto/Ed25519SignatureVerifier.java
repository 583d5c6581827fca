package com.project.pvb.crypto;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

public class Ed25519SignatureVerifier implements SignatureVerifier {

    @Override
    public boolean verify(byte[] message, byte[] signature, byte[] publicKey) {
        if (message == null || signature == null || publicKey == null) {
            return false;
        }
        if (signature.length != Ed25519PublicKeyParameters.KEY_SIZE * 2
                || publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE) {
            return false;
        }
        try {
            Ed25519Signer signer = new Ed25519Signer();
            signer.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            signer.update(message, 0, message.length);
            return signer.verifySignature(signature);
        } catch (IllegalArgumentException e) {
            // Key bytes do not decode to a curve point
            return false;
        }
    }
}
