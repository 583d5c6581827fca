package com.project.pvb.anchor;

import com.project.pvb.core.SubmissionLedger;
import com.project.pvb.core.TrustChainException;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.Submission;
import com.project.pvb.crypto.DeviceSigner;
import com.project.pvb.io.CanonicalJson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Anchors application documents into the ledger: canonical JSON, SHA-256, device
 * signature, submission. Anyone holding the same document can later prove it was
 * anchored by recomputing its canonical hash.
 */
public class DocumentAnchor {

    private final SubmissionLedger ledger;
    private final DeviceSigner signer;
    private final AnchorOptions options;

    public DocumentAnchor(SubmissionLedger ledger, DeviceSigner signer, AnchorOptions options) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.signer = Objects.requireNonNull(signer, "signer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * @param document any Jackson-serializable value, typically a map
     * @param dataType application-level type label stored in the metadata
     * @param objectId application-level identifier, may be null
     * @return empty when anchoring is disabled
     * @throws AnchorException when enabled but misconfigured, or when the ledger rejects the document
     */
    public Optional<AnchorResult> anchor(Object document, String dataType, String objectId) {
        if (!options.enabled()) {
            return Optional.empty();
        }

        List<String> missing = new ArrayList<>();
        if (options.deviceId() == null || options.deviceId().isBlank()) {
            missing.add("PVB_ANCHOR_DEVICE_ID");
        }
        if (options.dataUri() == null || options.dataUri().isBlank()) {
            missing.add("PVB_ANCHOR_DATA_URI");
        }
        if (!missing.isEmpty()) {
            throw new AnchorException("Missing required anchoring config: " + String.join(", ", missing));
        }

        DataHash dataHash = CanonicalJson.hash(document);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("canonicalization", CanonicalJson.CANONICALIZATION);
        metadata.put("hash", CanonicalJson.HASH_ALGORITHM);
        metadata.put("object_id", objectId);
        metadata.put("type", dataType);

        try {
            ledger.submitData(
                    DeviceId.fromName(options.deviceId()),
                    dataHash,
                    signer.sign(dataHash.toBytes()),
                    options.dataUri(),
                    CanonicalJson.canonicalString(metadata)
            );
        } catch (TrustChainException e) {
            throw new AnchorException("Ledger rejected anchored " + dataType + ": " + e.getMessage(), e);
        }

        Submission submission = ledger.verifySubmission(dataHash);
        return Optional.of(new AnchorResult(dataHash, submission.sequenceNumber(), metadata, submission.timestamp()));
    }
}
