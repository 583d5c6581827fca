package com.project.pvb.storage;

import com.project.pvb.io.StorageFetcher;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Fetches off-chain payloads over HTTP.
 *
 * Features:
 * - http/https URIs fetched directly
 * - ipfs:// and ar:// URIs resolved through configurable gateways
 * - Retries with exponential backoff
 * - Optional bearer token authentication
 * - Circuit breaker shared by all fetches of this instance
 *
 * A 404 yields {@link Optional#empty()}; exhausted retries or an open circuit raise
 * {@link UncheckedIOException}.
 */
public class HttpStorageFetcher implements StorageFetcher {

    private final OkHttpClient httpClient;
    private final StorageOptions options;
    private final CircuitBreaker circuitBreaker;

    public HttpStorageFetcher(StorageOptions options) {
        this(options, buildHttpClient(options), new CircuitBreaker("storage-http"));
    }

    HttpStorageFetcher(StorageOptions options, OkHttpClient httpClient, CircuitBreaker circuitBreaker) {
        this.options = options;
        this.httpClient = httpClient;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public Optional<byte[]> fetch(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            return Optional.empty();
        }
        HttpUrl url = resolve(dataUri.trim());
        if (url == null) {
            return Optional.empty();
        }
        Request.Builder builder = new Request.Builder().url(url).get();
        options.bearerToken().ifPresent(token -> builder.header("Authorization", "Bearer " + token.trim()));
        try {
            return executeWithRetry(builder.build());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to fetch " + dataUri, e);
        }
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Maps a data URI onto the HTTP URL it is served from, or null if the scheme is unsupported.
     */
    HttpUrl resolve(String dataUri) {
        String lower = dataUri.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return HttpUrl.parse(dataUri);
        }
        if (lower.startsWith("ipfs://")) {
            return HttpUrl.parse(options.ipfsGatewayUrl() + stripLeadingSlash(dataUri.substring("ipfs://".length())));
        }
        if (lower.startsWith("ar://")) {
            return HttpUrl.parse(options.arweaveGatewayUrl() + stripLeadingSlash(dataUri.substring("ar://".length())));
        }
        return null;
    }

    private Optional<byte[]> executeWithRetry(Request request) throws IOException {
        if (!circuitBreaker.canExecute()) {
            throw new IOException("Storage circuit breaker '" + circuitBreaker.getName()
                    + "' is OPEN - remote storage temporarily unavailable");
        }

        IOException last = null;
        long backoffMs = options.initialBackoffMillis();
        for (int attempt = 1; attempt <= options.maxRetries(); attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() == 404) {
                    circuitBreaker.recordSuccess();
                    return Optional.empty();
                }
                if (!response.isSuccessful()) {
                    throw new IOException("Storage fetch error " + response.code() + ": " + response.message());
                }
                ResponseBody body = response.body();
                byte[] bytes = body == null ? new byte[0] : body.bytes();
                circuitBreaker.recordSuccess();
                return Optional.of(bytes);
            } catch (IOException ex) {
                last = ex;
                if (attempt == options.maxRetries()) {
                    break;
                }
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    circuitBreaker.recordFailure();
                    throw new IOException("Interrupted during storage retry", ie);
                }
                backoffMs = Math.min(backoffMs * 2, 2000);
            }
        }
        circuitBreaker.recordFailure();
        throw new IOException("Storage request failed after " + options.maxRetries() + " attempts", last);
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }

    private static OkHttpClient buildHttpClient(StorageOptions options) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(options.callTimeout())
                .callTimeout(options.callTimeout())
                .build();
    }
}
