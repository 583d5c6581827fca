package com.project.pvb.anchor;

import com.project.pvb.core.SubmissionLedger;
import com.project.pvb.core.TrustChainException;
import com.project.pvb.core.TrustRegistry;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.Submission;
import com.project.pvb.crypto.DeviceSigner;
import com.project.pvb.crypto.Ed25519DeviceSigner;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.io.CanonicalJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Document anchoring")
class DocumentAnchorTest {

    private static final Address OWNER = Address.of("0x" + "01".repeat(20));
    private static final Address VERIFIER = Address.of("0x" + "a1".repeat(20));
    private static final String ANCHOR_DEVICE = "backend-anchor";

    private SubmissionLedger ledger;
    private DeviceSigner signer;

    @BeforeEach
    void setUp() {
        TrustRegistry registry = new TrustRegistry(OWNER, false);
        ledger = new SubmissionLedger(registry, OWNER, SignatureScheme.ED25519);
        signer = Ed25519DeviceSigner.generate();
        registry.registerVerifier(OWNER, VERIFIER, "Backend", null);
        registry.registerDevice(OWNER, DeviceId.fromName(ANCHOR_DEVICE), VERIFIER, signer.publicKey(), null);
    }

    @Test
    void disabledAnchoringDoesNothing() {
        DocumentAnchor anchor = new DocumentAnchor(ledger, signer, AnchorOptions.disabled());
        assertEquals(Optional.empty(), anchor.anchor(Map.of("a", 1), "report", "r-1"));
        assertEquals(0, ledger.getTotalSubmissions());
    }

    @Test
    void anchorsCanonicalHashWithProvenanceMetadata() {
        DocumentAnchor anchor = new DocumentAnchor(ledger, signer,
                new AnchorOptions(true, ANCHOR_DEVICE, "https://api.example.org/reports"));
        Map<String, Object> document = Map.of("title", "Inspection", "score", 92);

        AnchorResult result = anchor.anchor(document, "inspection_report", "r-42").orElseThrow();

        assertEquals(CanonicalJson.hash(document), result.dataHash());
        assertEquals(0, result.sequenceNumber());
        assertEquals("json:sorted_keys", result.metadata().get("canonicalization"));
        assertEquals("sha256", result.metadata().get("hash"));
        assertEquals("inspection_report", result.metadata().get("type"));
        assertEquals("r-42", result.metadata().get("object_id"));

        Submission submission = ledger.verifySubmission(result.dataHash());
        assertEquals(DeviceId.fromName(ANCHOR_DEVICE), submission.deviceId());
        assertEquals("https://api.example.org/reports", submission.dataUri());
        assertEquals(
                "{\"canonicalization\":\"json:sorted_keys\",\"hash\":\"sha256\","
                        + "\"object_id\":\"r-42\",\"type\":\"inspection_report\"}",
                submission.metadata());
        assertEquals(result.anchoredAt(), submission.timestamp());
    }

    @Test
    void missingConfigurationNamesEveryMissingSetting() {
        DocumentAnchor anchor = new DocumentAnchor(ledger, signer, new AnchorOptions(true, " ", null));

        AnchorException e = assertThrows(AnchorException.class, () -> anchor.anchor(Map.of(), "x", null));
        assertTrue(e.getMessage().contains("PVB_ANCHOR_DEVICE_ID"));
        assertTrue(e.getMessage().contains("PVB_ANCHOR_DATA_URI"));
    }

    @Test
    void ledgerRejectionIsWrapped() {
        DocumentAnchor anchor = new DocumentAnchor(ledger, signer,
                new AnchorOptions(true, ANCHOR_DEVICE, "ipfs://doc"));
        anchor.anchor(Map.of("n", 1), "doc", null);

        AnchorException e = assertThrows(AnchorException.class, () -> anchor.anchor(Map.of("n", 1), "doc", null));
        assertInstanceOf(TrustChainException.ConflictException.class, e.getCause());
        assertEquals(1, ledger.getTotalSubmissions());
    }

    @Test
    void unregisteredAnchorDeviceIsRejected() {
        DocumentAnchor anchor = new DocumentAnchor(ledger, signer,
                new AnchorOptions(true, "unknown-device", "ipfs://doc"));

        AnchorException e = assertThrows(AnchorException.class, () -> anchor.anchor(Map.of("n", 2), "doc", null));
        assertInstanceOf(TrustChainException.AuthorizationException.class, e.getCause());
    }
}
