package com.phillippitts.sitedetect.service.balancer;

import com.phillippitts.sitedetect.domain.ModelVersion;

/**
 * Outcome of a balancing decision. The breaker for {@link #endpoint()} has already admitted
 * the call, so the caller must report the outcome back to it.
 *
 * @param model chosen model version
 * @param experimentId A/B experiment that routed the call, or null for default balancing
 */
public record EngineSelection(ModelVersion model, String experimentId) {

    public String endpoint() {
        return model.endpoint();
    }

    public boolean fromExperiment() {
        return experimentId != null;
    }
}
