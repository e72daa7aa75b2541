package com.phillippitts.sitedetect.exception;

import java.util.UUID;

/**
 * Thrown when a status lookup misses request history (unknown id or evicted).
 */
public class RequestNotFoundException extends SiteDetectException {

    private final UUID requestId;

    public RequestNotFoundException(UUID requestId) {
        super("Detection request " + requestId + " not found");
        this.requestId = requestId;
    }

    public UUID getRequestId() {
        return requestId;
    }
}
