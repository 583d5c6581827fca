package com.project.pvb.crypto;

import java.util.Locale;

/**
 * Signature schemes a ledger can be configured to accept from its devices.
 */
public enum SignatureScheme {
    SECP256K1(
            "secp256k1",
            "Recoverable ECDSA over the raw 32-byte data hash, 65-byte r||s||v signatures, "
                    + "64-byte uncompressed public keys. Interoperable with Ethereum signing tools."
    ),
    ED25519(
            "ed25519",
            "EdDSA over Curve25519, 64-byte signatures and 32-byte public keys."
    );

    private final String id;
    private final String description;

    SignatureScheme(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public SignatureVerifier verifier() {
        return switch (this) {
            case SECP256K1 -> new Secp256k1SignatureVerifier();
            case ED25519 -> new Ed25519SignatureVerifier();
        };
    }

    public DeviceSigner generateSigner() {
        return switch (this) {
            case SECP256K1 -> Secp256k1DeviceSigner.generate();
            case ED25519 -> Ed25519DeviceSigner.generate();
        };
    }

    public static SignatureScheme fromEnv(String value, SignatureScheme fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SignatureScheme scheme : values()) {
            if (scheme.id.equals(normalized)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("Unknown signature scheme: " + value);
    }
}
