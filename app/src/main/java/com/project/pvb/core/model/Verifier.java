package com.project.pvb.core.model;

import java.time.Instant;

/**
 * Principal vouching for a set of devices.
 *
 * @param address      identity of the verifier.
 * @param name         display name of the verifying organization.
 * @param metadata     free-form metadata supplied at registration.
 * @param active       whether the verifier and its devices may currently submit.
 * @param registeredAt registration time.
 */
public record Verifier(
        Address address,
        String name,
        String metadata,
        boolean active,
        Instant registeredAt
) {

    public Verifier withActive(boolean value) {
        return new Verifier(address, name, metadata, value, registeredAt);
    }
}
