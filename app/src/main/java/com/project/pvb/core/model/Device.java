package com.project.pvb.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Device Security Module bound to one verifier.
 * Its authority is gated transitively by the owning verifier's active flag.
 *
 * @param deviceId        unique device identifier.
 * @param verifierAddress owning verifier.
 * @param publicKey       public half of the device signing key, encoding per signature scheme.
 * @param metadata        free-form metadata supplied at registration.
 * @param active          whether the device may currently submit.
 * @param registeredAt    registration time.
 */
public record Device(
        DeviceId deviceId,
        Address verifierAddress,
        byte[] publicKey,
        String metadata,
        boolean active,
        Instant registeredAt
) {

    public Device {
        publicKey = publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    public Device withActive(boolean value) {
        return new Device(deviceId, verifierAddress, publicKey, metadata, value, registeredAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Device other)) {
            return false;
        }
        return active == other.active
                && deviceId.equals(other.deviceId)
                && verifierAddress.equals(other.verifierAddress)
                && Arrays.equals(publicKey, other.publicKey)
                && Objects.equals(metadata, other.metadata)
                && Objects.equals(registeredAt, other.registeredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, verifierAddress, Arrays.hashCode(publicKey), metadata, active, registeredAt);
    }

    @Override
    public String toString() {
        return "Device[deviceId=" + deviceId + ", verifierAddress=" + verifierAddress
                + ", active=" + active + ", registeredAt=" + registeredAt + "]";
    }
}
