package com.project.pvb.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.pvb.core.InputValidator;
import com.project.pvb.core.TrustChainException.ValidationException;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.crypto.HashingUtils;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parses DSM output packages from JSON.
 *
 * Expected shape:
 * <pre>
 * {
 *   "device_id": "dsm-camera-01",
 *   "data_hash": "64 hex chars",
 *   "signature": "0x...",
 *   "timestamp": "2025-01-01T00:00:00Z",
 *   "data_uri": "ipfs://...",
 *   "metadata": { ... }
 * }
 * </pre>
 */
public class DsmOutputReader {

    public DsmOutput read(byte[] json) {
        JsonNode root;
        try {
            root = LedgerJson.mapper().readTree(json);
        } catch (IOException e) {
            throw new ValidationException("DSM output is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("DSM output must be a JSON object");
        }

        String deviceName = requiredText(root, "device_id");
        InputValidator.validateDeviceName(deviceName);

        String dataHashHex = requiredText(root, "data_hash");
        InputValidator.validateDataHashHex(dataHashHex);

        String signatureHex = requiredText(root, "signature").trim();
        byte[] signature;
        try {
            signature = HashingUtils.fromHex(signatureHex);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Signature must be hex encoded", e);
        }
        InputValidator.validateByteArray(signature, "Signature");

        String dataUri = requiredText(root, "data_uri").trim();
        InputValidator.validateDataUriScheme(dataUri);

        Instant capturedAt = parseTimestamp(requiredText(root, "timestamp"));

        JsonNode metadataNode = root.get("metadata");
        String metadata = "";
        if (metadataNode != null && !metadataNode.isNull()) {
            if (!metadataNode.isObject()) {
                throw new ValidationException("DSM output field 'metadata' must be a JSON object");
            }
            metadata = CanonicalJson.canonicalString(metadataNode);
        }

        return new DsmOutput(
                DeviceId.fromName(deviceName.trim()),
                DataHash.fromHex(dataHashHex.trim().toLowerCase(Locale.ROOT)),
                signature,
                capturedAt,
                dataUri,
                metadata
        );
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            throw new ValidationException("DSM output field '" + field + "' is required");
        }
        return node.asText();
    }

    private static Instant parseTimestamp(String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("DSM output timestamp must be ISO-8601: '" + value + "'", e);
        }
    }
}
