package com.project.pvb.io;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches fetches to a delegate chosen by the URI scheme.
 * URIs without a registered scheme go to the fallback, if any.
 */
public class RoutingStorageFetcher implements StorageFetcher {

    private final Map<String, StorageFetcher> routes;
    private final Optional<StorageFetcher> fallback;

    private RoutingStorageFetcher(Map<String, StorageFetcher> routes, Optional<StorageFetcher> fallback) {
        this.routes = Map.copyOf(routes);
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<byte[]> fetch(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            return Optional.empty();
        }
        StorageFetcher delegate = routes.get(schemeOf(dataUri));
        if (delegate != null) {
            return delegate.fetch(dataUri);
        }
        return fallback.flatMap(f -> f.fetch(dataUri));
    }

    static String schemeOf(String dataUri) {
        int colon = dataUri.indexOf(':');
        return colon > 0 ? dataUri.substring(0, colon).toLowerCase(Locale.ROOT) : "";
    }

    public static final class Builder {
        private final Map<String, StorageFetcher> routes = new LinkedHashMap<>();
        private StorageFetcher fallback;

        private Builder() {
        }

        public Builder route(String scheme, StorageFetcher fetcher) {
            routes.put(scheme.toLowerCase(Locale.ROOT), fetcher);
            return this;
        }

        public Builder fallback(StorageFetcher fetcher) {
            this.fallback = fetcher;
            return this;
        }

        public RoutingStorageFetcher build() {
            return new RoutingStorageFetcher(routes, Optional.ofNullable(fallback));
        }
    }
}
