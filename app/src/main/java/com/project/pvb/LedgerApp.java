package com.project.pvb;

import com.project.pvb.anchor.AnchorResult;
import com.project.pvb.anchor.DocumentAnchor;
import com.project.pvb.config.LedgerConfig;
import com.project.pvb.core.IntegrityAuditor;
import com.project.pvb.core.SubmissionLedger;
import com.project.pvb.core.TrustChainException;
import com.project.pvb.core.TrustRegistry;
import com.project.pvb.core.event.DataSubmitted;
import com.project.pvb.core.event.SubmissionListener;
import com.project.pvb.core.event.SubmissionVerified;
import com.project.pvb.core.model.Address;
import com.project.pvb.core.model.AuditPage;
import com.project.pvb.core.model.DataHash;
import com.project.pvb.core.model.DeviceId;
import com.project.pvb.core.model.LedgerStatus;
import com.project.pvb.crypto.DeviceSigner;
import com.project.pvb.crypto.ErrorLogger;
import com.project.pvb.crypto.Secp256k1DeviceSigner;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.io.AuditTrailWriter;
import com.project.pvb.io.LocalFileStorageFetcher;
import com.project.pvb.io.RoutingStorageFetcher;
import com.project.pvb.io.StorageFetcher;
import com.project.pvb.storage.HttpStorageFetcher;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line walkthrough of the trust chain: verifier and device registration,
 * signed submissions, revocation, off-chain integrity audit, audit pagination and audit export.
 *
 * Usage: {@code LedgerApp [config.json]}. Without an argument the configuration is read
 * from the environment.
 */
public class LedgerApp {

    public static void main(String[] args) {
        try {
            LedgerConfig config = args.length > 0 ? LedgerConfig.load(Paths.get(args[0])) : LedgerConfig.fromEnv();
            run(config, System.out);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        } finally {
            ErrorLogger.close();
        }
    }

    /**
     * @return path of the exported audit trail
     */
    public static Path run(LedgerConfig config, PrintStream out) throws Exception {
        SignatureScheme scheme = config.signatureScheme();
        out.println("Using signature scheme: " + scheme.id() + " - " + scheme.description());

        Address owner = config.owner().orElseGet(() -> {
            Address generated = Address.fromPublicKey(Secp256k1DeviceSigner.generate().publicKey());
            out.println("PVB_OWNER_ADDRESS not set. Using ephemeral owner " + generated);
            return generated;
        });

        TrustRegistry registry = new TrustRegistry(owner, config.openRegistration());
        SubmissionLedger ledger = new SubmissionLedger(registry, owner, scheme);
        ledger.addListener(new SubmissionListener() {
            @Override
            public void onDataSubmitted(DataSubmitted event) {
                out.printf("  DataSubmitted #%d %s from %s%n",
                        event.sequenceNumber(), event.dataHash(), event.deviceId());
            }

            @Override
            public void onSubmissionVerified(SubmissionVerified event) {
                out.printf("  SubmissionVerified %s valid=%s%n", event.dataHash(), event.isValid());
            }
        });

        Address verifierAddress = Address.fromPublicKey(Secp256k1DeviceSigner.generate().publicKey());
        registry.registerVerifier(owner, verifierAddress, "Demo Verification Authority", "walkthrough");
        out.println("Registered verifier " + verifierAddress);

        DeviceSigner signer = scheme.generateSigner();
        DeviceId deviceId = DeviceId.fromName("dsm-demo-01");
        registry.registerDevice(verifierAddress, deviceId, verifierAddress, signer.publicKey(), "{\"model\":\"demo\"}");
        out.println("Registered device " + deviceId + " under " + verifierAddress);

        DataHash first = submit(ledger, signer, deviceId, "first capture", "ipfs://demo-first");
        out.printf("Submitted %s (total: %d)%n", first, ledger.getTotalSubmissions());

        registry.setDeviceActive(verifierAddress, deviceId, false);
        try {
            submit(ledger, signer, deviceId, "second capture", "ipfs://demo-second");
            out.println("Unexpected: inactive device was allowed to submit");
        } catch (TrustChainException.AuthorizationException e) {
            out.println("Rejected while device inactive: " + e.getMessage());
        }
        registry.setDeviceActive(verifierAddress, deviceId, true);

        DataHash second = submit(ledger, signer, deviceId, "second capture", "ipfs://demo-second");
        out.printf("Submitted %s after reactivation (total: %d)%n", second, ledger.getTotalSubmissions());

        if (config.anchor().enabled()) {
            DeviceId anchorDevice = DeviceId.fromName(config.anchor().deviceId());
            registry.registerDevice(owner, anchorDevice, verifierAddress, signer.publicKey(), "anchor");
            Optional<AnchorResult> anchored = new DocumentAnchor(ledger, signer, config.anchor())
                    .anchor(Map.of("device", deviceId.toHex(), "submissions", ledger.getTotalSubmissions()),
                            "walkthrough_summary", null);
            anchored.ifPresent(result -> out.println("Anchored summary document as " + result.dataHash()));
        }

        out.println("Integrity of first payload: "
                + ledger.verifyDataIntegrity(first, "first capture".getBytes(StandardCharsets.UTF_8)));

        Path payloadDirectory = config.exportDirectory().resolve("payloads");
        storePayload(payloadDirectory, "demo-first", "first capture");
        storePayload(payloadDirectory, "demo-second", "tampered capture");
        IntegrityAuditor auditor = new IntegrityAuditor(ledger, storageFor(config, payloadDirectory));
        for (DataHash hash : ledger.getDeviceSubmissions(deviceId)) {
            IntegrityAuditor.IntegrityReport report = auditor.audit(hash);
            out.printf("Off-chain audit %s: intact=%s (%s)%n", hash, report.intact(), report.message());
        }

        LedgerStatus status = ledger.healthCheck();
        out.printf("Status: registryAccessible=%s verifiers=%d devices=%d submissions=%d%n",
                status.registryAccessible(), status.verifierCount(), status.deviceCount(), status.totalSubmissions());

        AuditPage page = ledger.getAuditTrail(0, (int) ledger.getTotalSubmissions());
        out.printf("Audit trail: %d of %d submissions%n", page.returnedCount(), page.totalSubmissions());
        Path exported = new AuditTrailWriter(config.exportDirectory()).write(page);
        out.println("Audit trail exported to: " + exported.toAbsolutePath());
        return exported;
    }

    /**
     * ipfs:// payloads are served from the local payload directory; http(s) and ar:// go through the gateways.
     */
    private static StorageFetcher storageFor(LedgerConfig config, Path payloadDirectory) {
        HttpStorageFetcher http = new HttpStorageFetcher(config.storage());
        return RoutingStorageFetcher.builder()
                .route("ipfs", new LocalFileStorageFetcher(payloadDirectory))
                .route("http", http)
                .route("https", http)
                .route("ar", http)
                .build();
    }

    private static void storePayload(Path directory, String name, String content) throws IOException {
        Files.createDirectories(directory);
        Files.writeString(directory.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static DataHash submit(SubmissionLedger ledger, DeviceSigner signer, DeviceId deviceId,
                                   String payload, String dataUri) {
        DataHash dataHash = DataHash.digest(payload.getBytes(StandardCharsets.UTF_8));
        return ledger.submitData(deviceId, dataHash, signer.sign(dataHash.toBytes()), dataUri, "{}");
    }
}
