package com.project.pvb.core.model;

import com.project.pvb.crypto.HashingUtils;

import java.nio.charset.StandardCharsets;

/**
 * 32-byte identifier of a Device Security Module.
 */
public final class DeviceId extends Bytes32Value {

    private DeviceId(byte[] bytes) {
        super(bytes);
    }

    public static DeviceId of(byte[] bytes) {
        return new DeviceId(bytes);
    }

    public static DeviceId fromHex(String hex) {
        if (!HashingUtils.isHex(hex, LENGTH)) {
            throw new IllegalArgumentException("Device id must be 64 hex characters: " + hex);
        }
        return new DeviceId(HashingUtils.fromHex(hex));
    }

    /**
     * Maps a device name onto an id by hashing its UTF-8 bytes. Every name is hashed, including one that
     * already looks like 64 hex characters; use {@link #fromHex(String)} for a raw id.
     */
    public static DeviceId fromName(String name) {
        return new DeviceId(HashingUtils.sha256(name.getBytes(StandardCharsets.UTF_8)));
    }
}
