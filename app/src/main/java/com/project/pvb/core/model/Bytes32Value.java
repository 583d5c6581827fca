package com.project.pvb.core.model;

import com.project.pvb.crypto.HashingUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 32-byte value with content equality, usable as a map key.
 */
public abstract class Bytes32Value {
    public static final int LENGTH = 32;

    private final byte[] bytes;

    protected Bytes32Value(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s must be %d bytes, got %d", getClass().getSimpleName(), LENGTH, bytes.length));
        }
        this.bytes = bytes.clone();
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public String toHex() {
        return HashingUtils.toHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((Bytes32Value) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
