package com.project.pvb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shape of a ledger configuration file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class LedgerConfigFile {

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("openRegistration")
    private Boolean openRegistration;

    @JsonProperty("signatureScheme")
    private String signatureScheme;

    @JsonProperty("exportDirectory")
    private String exportDirectory;

    @JsonProperty("storage")
    private Storage storage;

    @JsonProperty("anchor")
    private Anchor anchor;

    String owner() {
        return owner;
    }

    Boolean openRegistration() {
        return openRegistration;
    }

    String signatureScheme() {
        return signatureScheme;
    }

    String exportDirectory() {
        return exportDirectory;
    }

    Storage storage() {
        return storage;
    }

    Anchor anchor() {
        return anchor;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Storage {
        @JsonProperty("ipfsGatewayUrl")
        private String ipfsGatewayUrl;

        @JsonProperty("arweaveGatewayUrl")
        private String arweaveGatewayUrl;

        @JsonProperty("maxRetries")
        private Integer maxRetries;

        @JsonProperty("retryBackoffMillis")
        private Long retryBackoffMillis;

        @JsonProperty("timeoutMillis")
        private Long timeoutMillis;

        @JsonProperty("bearerToken")
        private String bearerToken;

        String ipfsGatewayUrl() {
            return ipfsGatewayUrl;
        }

        String arweaveGatewayUrl() {
            return arweaveGatewayUrl;
        }

        Integer maxRetries() {
            return maxRetries;
        }

        Long retryBackoffMillis() {
            return retryBackoffMillis;
        }

        Long timeoutMillis() {
            return timeoutMillis;
        }

        String bearerToken() {
            return bearerToken;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Anchor {
        @JsonProperty("enabled")
        private Boolean enabled;

        @JsonProperty("deviceId")
        private String deviceId;

        @JsonProperty("dataUri")
        private String dataUri;

        Boolean enabled() {
            return enabled;
        }

        String deviceId() {
            return deviceId;
        }

        String dataUri() {
            return dataUri;
        }
    }
}
