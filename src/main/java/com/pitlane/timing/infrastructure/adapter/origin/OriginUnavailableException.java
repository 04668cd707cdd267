package com.pitlane.timing.infrastructure.adapter.origin;

/**
 * The remote origin could not be reached or failed server-side. Retried, then handed to the
 * fallback.
 */
public class OriginUnavailableException extends RuntimeException {

    public OriginUnavailableException(String message) {
        super(message);
    }

    public OriginUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
