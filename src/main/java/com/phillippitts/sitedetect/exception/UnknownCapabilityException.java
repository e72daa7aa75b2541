package com.phillippitts.sitedetect.exception;

import com.phillippitts.sitedetect.domain.Capability;

/**
 * Thrown when no model version was ever registered for a capability. This is a
 * configuration error rather than a transient condition.
 */
public class UnknownCapabilityException extends SiteDetectException {

    private final Capability capability;

    public UnknownCapabilityException(Capability capability) {
        super("No model versions registered for capability: " + capability);
        this.capability = capability;
    }

    public Capability getCapability() {
        return capability;
    }
}
