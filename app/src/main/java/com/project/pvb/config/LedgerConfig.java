package com.project.pvb.config;

import com.project.pvb.anchor.AnchorOptions;
import com.project.pvb.core.model.Address;
import com.project.pvb.crypto.SignatureScheme;
import com.project.pvb.io.LedgerJson;
import com.project.pvb.storage.StorageOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

/**
 * Top-level configuration of a trust chain deployment.
 *
 * Configuration via environment variables:
 * - PVB_OWNER_ADDRESS: administrator of registry and ledger (generated at startup when absent)
 * - PVB_OPEN_REGISTRATION: whether principals may register themselves as verifiers (default true)
 * - PVB_SIGNATURE_SCHEME: secp256k1 (default) or ed25519
 * - PVB_EXPORT_DIR: directory for audit trail exports (default "outbox")
 * plus the variables read by {@link StorageOptions#fromEnv()} and {@link AnchorOptions#fromEnv()}.
 *
 * Alternatively the same settings can be read from a JSON file, see {@link #load(Path)}.
 */
public record LedgerConfig(
        Optional<Address> owner,
        boolean openRegistration,
        SignatureScheme signatureScheme,
        Path exportDirectory,
        StorageOptions storage,
        AnchorOptions anchor
) {

    public static final Path DEFAULT_EXPORT_DIRECTORY = Paths.get("outbox");

    public static LedgerConfig defaults() {
        return new LedgerConfig(
                Optional.empty(),
                true,
                SignatureScheme.SECP256K1,
                DEFAULT_EXPORT_DIRECTORY,
                StorageOptions.defaults(),
                AnchorOptions.disabled()
        );
    }

    public static LedgerConfig fromEnv() {
        String owner = System.getenv("PVB_OWNER_ADDRESS");
        String exportDir = System.getenv("PVB_EXPORT_DIR");
        return new LedgerConfig(
                owner == null || owner.isBlank() ? Optional.empty() : Optional.of(Address.of(owner.trim())),
                !"false".equalsIgnoreCase(System.getenv("PVB_OPEN_REGISTRATION")),
                SignatureScheme.fromEnv(System.getenv("PVB_SIGNATURE_SCHEME"), SignatureScheme.SECP256K1),
                exportDir == null || exportDir.isBlank() ? DEFAULT_EXPORT_DIRECTORY : Paths.get(exportDir.trim()),
                StorageOptions.fromEnv(),
                AnchorOptions.fromEnv()
        );
    }

    /**
     * Read configuration from a JSON file. Missing fields take their defaults.
     *
     * @throws IllegalStateException if the file cannot be read or parsed
     */
    public static LedgerConfig load(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Configuration file not found: " + file);
        }
        LedgerConfigFile raw;
        try {
            raw = LedgerJson.mapper().readValue(file.toFile(), LedgerConfigFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger configuration: " + file, e);
        }
        return fromFile(raw);
    }

    static LedgerConfig fromFile(LedgerConfigFile raw) {
        LedgerConfig defaults = defaults();
        StorageOptions storageDefaults = defaults.storage();

        LedgerConfigFile.Storage storage = raw.storage() == null ? new LedgerConfigFile.Storage() : raw.storage();
        LedgerConfigFile.Anchor anchor = raw.anchor() == null ? new LedgerConfigFile.Anchor() : raw.anchor();

        return new LedgerConfig(
                raw.owner() == null || raw.owner().isBlank() ? Optional.empty() : Optional.of(Address.of(raw.owner())),
                raw.openRegistration() == null ? defaults.openRegistration() : raw.openRegistration(),
                SignatureScheme.fromEnv(raw.signatureScheme(), defaults.signatureScheme()),
                raw.exportDirectory() == null || raw.exportDirectory().isBlank()
                        ? defaults.exportDirectory()
                        : Paths.get(raw.exportDirectory()),
                new StorageOptions(
                        storage.ipfsGatewayUrl(),
                        storage.arweaveGatewayUrl(),
                        storage.maxRetries() == null ? storageDefaults.maxRetries() : storage.maxRetries(),
                        storage.retryBackoffMillis() == null
                                ? storageDefaults.initialBackoffMillis()
                                : storage.retryBackoffMillis(),
                        storage.timeoutMillis() == null
                                ? storageDefaults.callTimeout()
                                : Duration.ofMillis(storage.timeoutMillis()),
                        Optional.ofNullable(storage.bearerToken())
                ),
                new AnchorOptions(Boolean.TRUE.equals(anchor.enabled()), anchor.deviceId(), anchor.dataUri())
        );
    }
}
