package com.phillippitts.sitedetect.exception;

import com.phillippitts.sitedetect.domain.Capability;

/**
 * Thrown by the load balancer when every candidate for a capability is disabled or
 * circuit-open. Captured into the capability's result; never fails a whole request.
 */
public class NoHealthyEngineException extends SiteDetectException {

    private final Capability capability;

    public NoHealthyEngineException(Capability capability, String reason) {
        super("No healthy engine for " + capability + ": " + reason);
        this.capability = capability;
    }

    public Capability getCapability() {
        return capability;
    }
}
