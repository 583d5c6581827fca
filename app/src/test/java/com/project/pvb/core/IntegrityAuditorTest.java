package com.project.pvb.core;

import com.project.pvb.core.TrustChainException.NotFoundException;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.crypto.DeviceSigner;
import com.project.pvb.crypto.Secp256k1DeviceSigner;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.io.LocalFileStorageFetcher;
import com.project.pvb.io.RoutingStorageFetcher;
import com.project.pvb.io.StorageFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Off-chain integrity audit")
class IntegrityAuditorTest {

    private static final Address OWNER = Address.of("0x" + "01".repeat(20));
    private static final DeviceId DEVICE = DeviceId.fromName("scanner");

    @TempDir
    Path storage;

    private SubmissionLedger ledger;
    private DeviceSigner signer;

    @BeforeEach
    void setUp() {
        TrustRegistry registry = new TrustRegistry(OWNER, false);
        ledger = new SubmissionLedger(registry, OWNER, SignatureScheme.SECP256K1);
        signer = Secp256k1DeviceSigner.generate();
        registry.registerVerifier(OWNER, OWNER, "Self", null);
        registry.registerDevice(OWNER, DEVICE, OWNER, signer.publicKey(), null);
    }

    private DataHash submit(byte[] payload, String dataUri) {
        DataHash hash = DataHash.digest(payload);
        return ledger.submitData(DEVICE, hash, signer.sign(hash.toBytes()), dataUri, "{}");
    }

    @Test
    void intactPayloadPasses() throws IOException {
        byte[] payload = "scan-001".getBytes(StandardCharsets.UTF_8);
        Files.write(storage.resolve("scan-001"), payload);
        DataHash hash = submit(payload, "ipfs://scan-001");

        IntegrityAuditor.IntegrityReport report =
                new IntegrityAuditor(ledger, new LocalFileStorageFetcher(storage)).audit(hash);

        assertTrue(report.fetched());
        assertTrue(report.intact());
        assertEquals("ipfs://scan-001", report.dataUri());
        assertTrue(report.message().contains("#0"));
    }

    @Test
    void alteredPayloadDetected() throws IOException {
        byte[] payload = "original".getBytes(StandardCharsets.UTF_8);
        DataHash hash = submit(payload, "file:doc.bin");
        Files.write(storage.resolve("doc.bin"), "altered".getBytes(StandardCharsets.UTF_8));

        IntegrityAuditor.IntegrityReport report =
                new IntegrityAuditor(ledger, new LocalFileStorageFetcher(storage)).audit(hash);

        assertTrue(report.fetched());
        assertFalse(report.intact());
    }

    @Test
    void missingPayloadReportedNotThrown() {
        DataHash hash = submit("gone".getBytes(StandardCharsets.UTF_8), "ipfs://gone");

        IntegrityAuditor.IntegrityReport report =
                new IntegrityAuditor(ledger, new LocalFileStorageFetcher(storage)).audit(hash);

        assertFalse(report.fetched());
        assertFalse(report.intact());
    }

    @Test
    void fetchFailureReportedNotThrown() {
        DataHash hash = submit("remote".getBytes(StandardCharsets.UTF_8), "https://down.example/remote");
        StorageFetcher failing = uri -> {
            throw new UncheckedIOException(new IOException("connection refused"));
        };

        IntegrityAuditor.IntegrityReport report = new IntegrityAuditor(ledger, failing).audit(hash);

        assertFalse(report.fetched());
        assertTrue(report.message().contains("connection refused"));
    }

    @Test
    void unknownHashNotFound() {
        IntegrityAuditor auditor = new IntegrityAuditor(ledger, uri -> Optional.empty());
        assertThrows(NotFoundException.class,
                () -> auditor.audit(DataHash.digest("never".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void routingPicksFetcherByScheme() throws IOException {
        byte[] local = "local".getBytes(StandardCharsets.UTF_8);
        byte[] remote = "remote".getBytes(StandardCharsets.UTF_8);
        Files.write(storage.resolve("local"), local);
        DataHash localHash = submit(local, "ipfs://local");
        DataHash remoteHash = submit(remote, "https://cdn.example/remote");

        StorageFetcher routing = RoutingStorageFetcher.builder()
                .route("HTTPS", uri -> Optional.of(remote))
                .fallback(new LocalFileStorageFetcher(storage))
                .build();
        IntegrityAuditor auditor = new IntegrityAuditor(ledger, routing);

        assertTrue(auditor.audit(localHash).intact());
        assertTrue(auditor.audit(remoteHash).intact());
    }

    @Test
    void localFetcherStaysInsideBaseDirectory() throws IOException {
        Path inner = Files.createDirectories(storage.resolve("inner"));
        Files.write(storage.resolve("secret"), new byte[]{1});
        Files.write(inner.resolve("blob.bin"), new byte[]{2});
        LocalFileStorageFetcher fetcher = new LocalFileStorageFetcher(inner);

        assertEquals(Optional.empty(), fetcher.fetch("file:../secret"));
        assertEquals(Optional.empty(), fetcher.fetch(""));
        assertArrayEquals(new byte[]{2}, fetcher.fetch("ipfs://blob").orElseThrow());
        assertArrayEquals(new byte[]{2}, fetcher.fetch("file://blob.bin").orElseThrow());
    }
}
