package com.phillippitts.sitedetect.exception;

/**
 * Base exception for all orchestrator-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class SiteDetectException extends RuntimeException {

    public SiteDetectException(String message) {
        super(message);
    }

    public SiteDetectException(String message, Throwable cause) {
        super(message, cause);
    }
}
