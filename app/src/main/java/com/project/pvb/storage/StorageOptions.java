package com.project.pvb.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings for remote payload fetches.
 *
 * Configuration via environment variables:
 * - PVB_IPFS_GATEWAY_URL: gateway used for ipfs:// URIs (default https://ipfs.io/ipfs/)
 * - PVB_ARWEAVE_GATEWAY_URL: gateway used for ar:// URIs (default https://arweave.net/)
 * - PVB_STORAGE_MAX_RETRIES: attempts per fetch (default 3)
 * - PVB_STORAGE_RETRY_BACKOFF_MS: initial backoff, doubled per attempt up to 2s (default 200)
 * - PVB_STORAGE_TIMEOUT_MS: overall call timeout (default 30000)
 * - PVB_STORAGE_BEARER_TOKEN: optional Authorization bearer token
 */
public record StorageOptions(
        String ipfsGatewayUrl,
        String arweaveGatewayUrl,
        int maxRetries,
        long initialBackoffMillis,
        Duration callTimeout,
        Optional<String> bearerToken
) {

    public static final String DEFAULT_IPFS_GATEWAY = "https://ipfs.io/ipfs/";
    public static final String DEFAULT_ARWEAVE_GATEWAY = "https://arweave.net/";

    public StorageOptions {
        ipfsGatewayUrl = normalizeGateway(ipfsGatewayUrl, DEFAULT_IPFS_GATEWAY);
        arweaveGatewayUrl = normalizeGateway(arweaveGatewayUrl, DEFAULT_ARWEAVE_GATEWAY);
        maxRetries = Math.max(maxRetries, 1);
        initialBackoffMillis = Math.max(initialBackoffMillis, 0L);
        bearerToken = bearerToken == null ? Optional.empty() : bearerToken.filter(t -> !t.isBlank());
    }

    public static StorageOptions defaults() {
        return new StorageOptions(DEFAULT_IPFS_GATEWAY, DEFAULT_ARWEAVE_GATEWAY, 3, 200L,
                Duration.ofSeconds(30), Optional.empty());
    }

    public static StorageOptions fromEnv() {
        return new StorageOptions(
                getenv("PVB_IPFS_GATEWAY_URL"),
                getenv("PVB_ARWEAVE_GATEWAY_URL"),
                parseInt(getenv("PVB_STORAGE_MAX_RETRIES"), 3),
                parseLong(getenv("PVB_STORAGE_RETRY_BACKOFF_MS"), 200L),
                Duration.ofMillis(parseLong(getenv("PVB_STORAGE_TIMEOUT_MS"), 30_000L)),
                Optional.ofNullable(getenv("PVB_STORAGE_BEARER_TOKEN"))
        );
    }

    private static String normalizeGateway(String gateway, String fallback) {
        if (gateway == null || gateway.isBlank()) {
            return fallback;
        }
        String trimmed = gateway.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static String getenv(String name) {
        return System.getenv(name);
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
