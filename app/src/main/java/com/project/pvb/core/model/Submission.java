package com.project.pvb.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable ledger record of one attested data hash.
 *
 * @param dataHash        content address, primary key.
 * @param deviceId        submitting device.
 * @param verifierAddress owning verifier at submission time.
 * @param signature       device signature over the raw data hash bytes.
 * @param timestamp       wall-clock time of commit.
 * @param dataUri         pointer to the off-chain payload.
 * @param metadata        caller-supplied metadata.
 * @param verified        signature verification outcome.
 * @param sequenceNumber  position in the global history, starting at zero.
 */
public record Submission(
        DataHash dataHash,
        DeviceId deviceId,
        Address verifierAddress,
        byte[] signature,
        Instant timestamp,
        String dataUri,
        String metadata,
        boolean verified,
        long sequenceNumber
) {

    public Submission {
        signature = signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Submission other)) {
            return false;
        }
        return verified == other.verified
                && sequenceNumber == other.sequenceNumber
                && dataHash.equals(other.dataHash)
                && deviceId.equals(other.deviceId)
                && verifierAddress.equals(other.verifierAddress)
                && Arrays.equals(signature, other.signature)
                && Objects.equals(timestamp, other.timestamp)
                && Objects.equals(dataUri, other.dataUri)
                && Objects.equals(metadata, other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataHash, sequenceNumber);
    }

    @Override
    public String toString() {
        return "Submission[#" + sequenceNumber + " dataHash=" + dataHash + ", deviceId=" + deviceId
                + ", verifier=" + verifierAddress + ", dataUri=" + dataUri + "]";
    }
}
