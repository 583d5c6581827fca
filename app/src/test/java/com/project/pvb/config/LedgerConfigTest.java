package com.project.pvb.config;

import com.project.pvb.core.model.Address;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.storage.StorageOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LedgerConfigTest {

    @Test
    void loadsEveryFieldFromJson() throws URISyntaxException {
        Path file = Paths.get(getClass().getResource("/ledger-config.json").toURI());

        LedgerConfig config = LedgerConfig.load(file);

        assertEquals(Optional.of(Address.of("0x" + "00".repeat(19) + "aa")), config.owner());
        assertFalse(config.openRegistration());
        assertEquals(SignatureScheme.ED25519, config.signatureScheme());
        assertEquals(Paths.get("audit-out"), config.exportDirectory());

        StorageOptions storage = config.storage();
        assertEquals("http://127.0.0.1:8080/ipfs/", storage.ipfsGatewayUrl());
        assertEquals(StorageOptions.DEFAULT_ARWEAVE_GATEWAY, storage.arweaveGatewayUrl());
        assertEquals(5, storage.maxRetries());
        assertEquals(StorageOptions.defaults().initialBackoffMillis(), storage.initialBackoffMillis());
        assertEquals(Duration.ofMillis(1500), storage.callTimeout());
        assertEquals(Optional.of("token-123"), storage.bearerToken());

        assertTrue(config.anchor().enabled());
        assertEquals("backend-anchor", config.anchor().deviceId());
        assertEquals("https://api.example.org/documents", config.anchor().dataUri());
    }

    @Test
    void emptyDocumentYieldsDefaults(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.json"), "{}");

        LedgerConfig config = LedgerConfig.load(file);
        LedgerConfig defaults = LedgerConfig.defaults();

        assertEquals(Optional.empty(), config.owner());
        assertEquals(defaults.openRegistration(), config.openRegistration());
        assertEquals(SignatureScheme.SECP256K1, config.signatureScheme());
        assertEquals(LedgerConfig.DEFAULT_EXPORT_DIRECTORY, config.exportDirectory());
        assertEquals(defaults.storage(), config.storage());
        assertFalse(config.anchor().enabled());
    }

    @Test
    void missingOrMalformedFileFails(@TempDir Path dir) throws IOException {
        assertThrows(IllegalStateException.class, () -> LedgerConfig.load(dir.resolve("absent.json")));

        Path broken = Files.writeString(dir.resolve("broken.json"), "{ not json");
        assertThrows(IllegalStateException.class, () -> LedgerConfig.load(broken));
    }

    @Test
    void invalidValuesRejected(@TempDir Path dir) throws IOException {
        Path badScheme = Files.writeString(dir.resolve("scheme.json"), "{\"signatureScheme\":\"rsa\"}");
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.load(badScheme));

        Path badOwner = Files.writeString(dir.resolve("owner.json"), "{\"owner\":\"0x1234\"}");
        assertThrows(IllegalArgumentException.class, () -> LedgerConfig.load(badOwner));
    }
}
