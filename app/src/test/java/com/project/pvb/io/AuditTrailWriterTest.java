package com.project.pvb.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.pvb.core.SubmissionLedger;
import com.project.pvb.core.TrustRegistry;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.AuditPage;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.crypto.DeviceSigner;
import com.project.pvb.crypto.HashingUtils;
import com.project.pvb.crypto.Secp256k1DeviceSigner;
import com.project.pvb.crypto.SignatureScheme;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailWriterTest {

    private static final Address OWNER = Address.of("0x" + "01".repeat(20));
    private static final Address VERIFIER = Address.of("0x" + "a1".repeat(20));
    private static final DeviceId DEVICE = DeviceId.fromName("camera");

    @Test
    void writesPageAsJsonFileNamedByRange(@TempDir Path dir) throws IOException {
        Clock clock = Clock.fixed(Instant.parse("2025-02-02T10:00:00Z"), ZoneOffset.UTC);
        TrustRegistry registry = new TrustRegistry(OWNER, false, clock);
        SubmissionLedger ledger = new SubmissionLedger(registry, OWNER, SignatureScheme.SECP256K1, clock);
        DeviceSigner signer = Secp256k1DeviceSigner.generate();
        registry.registerVerifier(OWNER, VERIFIER, "Acme", null);
        registry.registerDevice(OWNER, DEVICE, VERIFIER, signer.publicKey(), null);

        DataHash last = null;
        for (int i = 0; i < 3; i++) {
            DataHash hash = DataHash.digest(("shot-" + i).getBytes(StandardCharsets.UTF_8));
            last = ledger.submitData(DEVICE, hash, signer.sign(hash.toBytes()), "ipfs://shot-" + i, "{\"i\":" + i + "}");
        }

        AuditPage page = ledger.getAuditTrail(1, 5);
        Path exportDir = dir.resolve("exports");
        Path written = new AuditTrailWriter(exportDir).write(page);

        assertEquals(exportDir.resolve("audit-1-3.json"), written);
        JsonNode root = LedgerJson.mapper().readTree(Files.readAllBytes(written));
        assertEquals(3, root.get("submissionCount").asLong());
        assertEquals(1, root.get("startIndex").asLong());
        assertEquals(2, root.get("returnedCount").asInt());
        assertTrue(root.hasNonNull("exportedAt"));

        JsonNode record = root.get("submissions").get(1);
        assertEquals(2, record.get("sequenceNumber").asLong());
        assertEquals(last.toHex(), record.get("dataHash").asText());
        assertEquals(DEVICE.toHex(), record.get("deviceId").asText());
        assertEquals(VERIFIER.value(), record.get("verifierAddress").asText());
        assertEquals(HashingUtils.toHex(ledger.verifySubmission(last).signature()), record.get("signature").asText());
        assertEquals("2025-02-02T10:00:00Z", record.get("timestamp").asText());
        assertEquals("ipfs://shot-2", record.get("dataUri").asText());
        assertEquals("{\"i\":2}", record.get("metadata").asText());
        assertTrue(record.get("verified").asBoolean());
    }
}
