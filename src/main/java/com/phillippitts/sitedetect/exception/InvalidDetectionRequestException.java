package com.phillippitts.sitedetect.exception;

/**
 * Thrown when caller input cannot be processed (missing photo reference, malformed
 * experiment definition).
 */
public class InvalidDetectionRequestException extends SiteDetectException {

    private final String reason;

    public InvalidDetectionRequestException(String reason) {
        super("Invalid detection request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
