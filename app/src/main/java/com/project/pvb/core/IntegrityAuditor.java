package com.project.pvb.core;

import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.Submission;
import com.project.pvb.crypto.ErrorLogger;
import com.project.pvb.io.StorageFetcher;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks that the off-chain payload a submission points to still hashes to the recorded data hash.
 */
public class IntegrityAuditor {

    private final SubmissionLedger ledger;
    private final StorageFetcher fetcher;

    public IntegrityAuditor(SubmissionLedger ledger, StorageFetcher fetcher) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    }

    /**
     * Fetch the payload behind a submission's data URI and compare its hash.
     *
     * @throws TrustChainException.NotFoundException if the hash was never submitted
     */
    public IntegrityReport audit(DataHash dataHash) {
        Submission submission = ledger.verifySubmission(dataHash);
        String dataUri = submission.dataUri();

        Optional<byte[]> payload;
        try {
            payload = fetcher.fetch(dataUri);
        } catch (UncheckedIOException | IllegalStateException e) {
            ErrorLogger.logWarning("audit", "Could not retrieve " + dataUri + ": " + e.getMessage());
            return new IntegrityReport(dataHash, dataUri, false, false,
                    "Payload could not be retrieved: " + e.getMessage());
        }

        if (payload.isEmpty()) {
            return new IntegrityReport(dataHash, dataUri, false, false,
                    "No payload found at " + dataUri);
        }

        boolean intact = ledger.verifyDataIntegrity(dataHash, payload.get());
        String message = intact
                ? String.format("Payload at %s matches submission #%d", dataUri, submission.sequenceNumber())
                : String.format("Payload at %s does not hash to %s - content was altered or replaced", dataUri, dataHash);
        return new IntegrityReport(dataHash, dataUri, true, intact, message);
    }

    /**
     * Outcome of an off-chain integrity audit.
     */
    public record IntegrityReport(
            DataHash dataHash,
            String dataUri,
            boolean fetched,
            boolean intact,
            String message
    ) {
    }
}
