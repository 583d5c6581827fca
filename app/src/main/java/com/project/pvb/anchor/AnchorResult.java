package com.project.pvb.anchor;

import com.project.pvb.core.model.DataHash;

import java.time.Instant;
import java.util.Map;

/**
 * Receipt of an anchored document.
 *
 * @param dataHash       SHA-256 of the canonical document bytes.
 * @param sequenceNumber position of the anchoring submission in the ledger history.
 * @param metadata       metadata recorded with the submission.
 * @param anchoredAt     commit time of the submission.
 */
public record AnchorResult(
        DataHash dataHash,
        long sequenceNumber,
        Map<String, Object> metadata,
        Instant anchoredAt
) {
}
