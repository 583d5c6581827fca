package com.project.pvb.core;

import com.project.pvb.core.TrustChainException.ValidationException;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Input validation for registry and ledger operations.
 *
 * Covers:
 * - Verifier names and device names (length, emptiness)
 * - Data URIs (emptiness, supported schemes for DSM intake)
 * - Byte arrays such as signatures and public keys
 */
public final class InputValidator {

    private static final int VERIFIER_NAME_MAX_LENGTH = 100;
    private static final int DEVICE_NAME_MAX_LENGTH = 64;

    private static final Set<String> SUPPORTED_URI_SCHEMES = Set.of("http", "https", "ipfs", "ar");

    private static final Pattern SHA256_HEX = Pattern.compile("^(0x)?[a-fA-F0-9]{64}$");

    private InputValidator() {}

    public static void validateVerifierName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Verifier name must not be empty");
        }
        if (name.trim().length() > VERIFIER_NAME_MAX_LENGTH) {
            throw new ValidationException(
                String.format("Verifier name too long: %d characters exceeds maximum of %d",
                    name.trim().length(), VERIFIER_NAME_MAX_LENGTH)
            );
        }
    }

    public static void validateDeviceName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Device ID must not be empty");
        }
        if (name.trim().length() > DEVICE_NAME_MAX_LENGTH) {
            throw new ValidationException(
                String.format("Device ID too long: %d characters exceeds maximum of %d",
                    name.trim().length(), DEVICE_NAME_MAX_LENGTH)
            );
        }
    }

    /**
     * Validate a SHA-256 hex digest, with or without {@code 0x}.
     */
    public static void validateDataHashHex(String hex) {
        if (hex == null || !SHA256_HEX.matcher(hex.trim()).matches()) {
            throw new ValidationException("Data hash must be a valid SHA-256 hash (64 hex characters)");
        }
    }

    public static void validateDataUri(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            throw new ValidationException("Data URI must not be empty");
        }
    }

    /**
     * Stricter variant used for DSM packages: the URI must name a supported storage protocol.
     */
    public static void validateDataUriScheme(String dataUri) {
        validateDataUri(dataUri);
        int colon = dataUri.indexOf("://");
        String scheme = colon > 0 ? dataUri.substring(0, colon).toLowerCase(Locale.ROOT) : "";
        if (!SUPPORTED_URI_SCHEMES.contains(scheme)) {
            throw new ValidationException(
                String.format("Data URI must use a supported protocol %s: '%s'", SUPPORTED_URI_SCHEMES, dataUri)
            );
        }
    }

    /**
     * Validate byte array is not null or empty.
     *
     * @param data The byte array to validate
     * @param fieldName Name of the field for error messages
     * @throws ValidationException if validation fails
     */
    public static void validateByteArray(byte[] data, String fieldName) {
        if (data == null) {
            throw new ValidationException(fieldName + " must not be null");
        }
        if (data.length == 0) {
            throw new ValidationException(fieldName + " must not be empty");
        }
    }

    public static void validateNonNegative(long value, String fieldName) {
        if (value < 0) {
            throw new ValidationException(
                String.format("%s must not be negative: got %d", fieldName, value)
            );
        }
    }

    public static String normalizeMetadata(String metadata) {
        return metadata == null ? "" : metadata;
    }
}
