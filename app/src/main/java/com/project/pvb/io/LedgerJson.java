package com.project.pvb.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.pvb.core.model.Submission;
import com.project.pvb.crypto.HashingUtils;

/**
 * Shared Jackson configuration and JSON views of ledger records.
 */
public final class LedgerJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private LedgerJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toJson(Submission submission) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sequenceNumber", submission.sequenceNumber());
        node.put("dataHash", submission.dataHash().toHex());
        node.put("deviceId", submission.deviceId().toHex());
        node.put("verifierAddress", submission.verifierAddress().value());
        node.put("signature", HashingUtils.toHex(submission.signature()));
        node.put("timestamp", submission.timestamp().toString());
        node.put("dataUri", submission.dataUri());
        node.put("metadata", submission.metadata());
        node.put("verified", submission.verified());
        return node;
    }
}
