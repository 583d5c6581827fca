package com.project.pvb.core.model;

import com.project.pvb.crypto.HashingUtils;
import com.project.pvb.crypto.Secp256k1SignatureVerifier;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.Objects;

/**
 * 20-byte principal address, held in its canonical lower-case {@code 0x} form.
 */
public record Address(String value) {

    public static final int LENGTH = 20;

    public Address {
        Objects.requireNonNull(value, "value must not be null");
        if (!HashingUtils.isHex(value, LENGTH)) {
            throw new IllegalArgumentException("Address must be 40 hex characters: " + value);
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        value = normalized.startsWith("0x") ? normalized : "0x" + normalized;
    }

    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * Ethereum-style address of an uncompressed secp256k1 public key, either 64-byte {@code x||y}
     * or 65-byte with the {@code 0x04} prefix.
     */
    public static Address fromPublicKey(byte[] publicKey) {
        byte[] normalized = Secp256k1SignatureVerifier.normalizePublicKey(publicKey);
        if (normalized == null) {
            throw new IllegalArgumentException("Public key must be 64 bytes, or 65 bytes with a 0x04 prefix");
        }
        return new Address(Keys.getAddress(Numeric.toBigInt(normalized)));
    }

    @Override
    public String toString() {
        return value;
    }
}
