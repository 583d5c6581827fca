package com.project.pvb.anchor;

/**
 * Settings for anchoring application documents into the ledger.
 *
 * Configuration via environment variables:
 * - PVB_ANCHOR_ENABLED: "true" to enable anchoring
 * - PVB_ANCHOR_DEVICE_ID: device name or 64-hex id that signs anchored documents
 * - PVB_ANCHOR_DATA_URI: URI recorded with every anchored document
 */
public record AnchorOptions(boolean enabled, String deviceId, String dataUri) {

    public static AnchorOptions disabled() {
        return new AnchorOptions(false, null, null);
    }

    public static AnchorOptions fromEnv() {
        return new AnchorOptions(
                "true".equalsIgnoreCase(System.getenv("PVB_ANCHOR_ENABLED")),
                System.getenv("PVB_ANCHOR_DEVICE_ID"),
                System.getenv("PVB_ANCHOR_DATA_URI")
        );
    }
}
