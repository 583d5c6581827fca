package com.project.pvb.core;

/**
 * Base type of every typed failure raised by the registry and the ledger.
 *
 * A failed write never leaves partial state behind, so callers should treat any of
 * these as a no-op rather than a transient condition worth retrying.
 */
public abstract class TrustChainException extends RuntimeException {

    public enum ErrorKind {
        VALIDATION,
        AUTHORIZATION,
        CONFLICT,
        NOT_FOUND,
        INTEGRITY,
        RANGE
    }

    private final ErrorKind kind;

    protected TrustChainException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TrustChainException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Malformed or empty input fields.
     */
    public static class ValidationException extends TrustChainException {
        public ValidationException(String message) {
            super(ErrorKind.VALIDATION, message);
        }

        public ValidationException(String message, Throwable cause) {
            super(ErrorKind.VALIDATION, message, cause);
        }
    }

    /**
     * Principal unknown, inactive, or not allowed to perform the operation.
     */
    public static class AuthorizationException extends TrustChainException {
        public AuthorizationException(String message) {
            super(ErrorKind.AUTHORIZATION, message);
        }
    }

    public static class ConflictException extends TrustChainException {
        public ConflictException(String message) {
            super(ErrorKind.CONFLICT, message);
        }
    }

    public static class NotFoundException extends TrustChainException {
        public NotFoundException(String message) {
            super(ErrorKind.NOT_FOUND, message);
        }
    }

    /**
     * Signature did not verify against the device key.
     */
    public static class IntegrityException extends TrustChainException {
        public IntegrityException(String message) {
            super(ErrorKind.INTEGRITY, message);
        }
    }

    /**
     * Pagination start index outside the committed history.
     */
    public static class RangeException extends TrustChainException {
        public RangeException(String message) {
            super(ErrorKind.RANGE, message);
        }
    }
}
