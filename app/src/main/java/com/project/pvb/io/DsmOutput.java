package com.project.pvb.io;

import com.project.pvb.core.SubmissionLedger;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;

import java.time.Instant;

/**
 * Data package emitted by a Device Security Module: the hash of a captured payload,
 * the device's signature over it and a pointer to the off-chain payload.
 *
 * @param deviceId   device that produced the package.
 * @param dataHash   SHA-256 of the payload.
 * @param signature  device signature over the raw hash bytes.
 * @param capturedAt capture/signing time reported by the device (informational).
 * @param dataUri    off-chain location of the payload.
 * @param metadata   canonical JSON of the device metadata, empty if none.
 */
public record DsmOutput(
        DeviceId deviceId,
        DataHash dataHash,
        byte[] signature,
        Instant capturedAt,
        String dataUri,
        String metadata
) {

    public DsmOutput {
        signature = signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    public DataHash submitTo(SubmissionLedger ledger) {
        return ledger.submitData(deviceId, dataHash, signature, dataUri, metadata);
    }
}
