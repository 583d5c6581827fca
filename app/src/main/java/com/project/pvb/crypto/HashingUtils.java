package com.project.pvb.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for content addressing.
 *
 * Every data hash in the ledger is the SHA-256 digest of the raw payload bytes,
 * and human-readable device names are mapped to 32-byte ids with the same digest.
 */
public final class HashingUtils {
    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    });

    private HashingUtils() {
    }

    public static byte[] sha256(byte[] input) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Lower-case hex with {@code 0x} prefix.
     */
    public static String toHex(byte[] input) {
        return "0x" + HexFormat.of().formatHex(input);
    }

    /**
     * Parse hex string to bytes, with or without {@code 0x} prefix.
     *
     * @throws IllegalArgumentException if the string is not valid hex
     */
    public static byte[] fromHex(String hex) {
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return HexFormat.of().parseHex(normalized);
    }

    public static boolean isHex(String value, int expectedBytes) {
        if (value == null) {
            return false;
        }
        String normalized = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        if (normalized.length() != expectedBytes * 2) {
            return false;
        }
        for (int i = 0; i < normalized.length(); i++) {
            if (Character.digit(normalized.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
