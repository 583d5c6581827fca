package com.project.pvb.core.model;

import com.project.pvb.crypto.HashingUtils;

/**
 * Content address of a data payload: the SHA-256 digest of its bytes.
 */
public final class DataHash extends Bytes32Value {

    public static final DataHash ZERO = new DataHash(new byte[LENGTH]);

    private DataHash(byte[] bytes) {
        super(bytes);
    }

    public static DataHash of(byte[] bytes) {
        return new DataHash(bytes);
    }

    public static DataHash fromHex(String hex) {
        if (!HashingUtils.isHex(hex, LENGTH)) {
            throw new IllegalArgumentException("Data hash must be 64 hex characters: " + hex);
        }
        return new DataHash(HashingUtils.fromHex(hex));
    }

    public static DataHash digest(byte[] data) {
        return new DataHash(HashingUtils.sha256(data));
    }
}
