package com.project.pvb.anchor;

/**
 * Raised when anchoring is enabled but cannot be carried out.
 */
public class AnchorException extends RuntimeException {
    public AnchorException(String message) {
        super(message);
    }

    public AnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
