package com.project.pvb.core.model;

import java.time.Instant;

/**
 * Point-in-time health snapshot of a ledger and the registry it consults.
 *
 * @param registryAccessible whether the registry answered its count queries.
 * @param verifierCount      registered verifiers, active or not; 0 when the registry is not accessible.
 * @param deviceCount        registered devices, active or not; 0 when the registry is not accessible.
 * @param totalSubmissions   committed submissions.
 * @param registryOwner      owner of the registry currently consulted.
 * @param signatureScheme    id of the scheme submissions are verified with.
 * @param timestamp          when the snapshot was taken.
 */
public record LedgerStatus(
        boolean registryAccessible,
        int verifierCount,
        int deviceCount,
        long totalSubmissions,
        Address registryOwner,
        String signatureScheme,
        Instant timestamp
) {
}
