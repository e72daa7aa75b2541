package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * Static traffic split between two model versions of the same capability.
 *
 * <p>{@code trafficSplit} is the probability that a single request is routed to {@code modelA};
 * it is not a hard quota.
 *
 * @param experimentId unique experiment identifier
 * @param modelA arm receiving {@code trafficSplit} of the traffic
 * @param modelB arm receiving the remainder
 * @param trafficSplit fraction routed to A, in [0, 1]
 * @param enabled whether the experiment overrides default balancing
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ABTestConfig(
        String experimentId,
        ModelVersion modelA,
        ModelVersion modelB,
        double trafficSplit,
        boolean enabled
) {

    public ABTestConfig {
        if (experimentId == null || experimentId.isBlank()) {
            throw new IllegalArgumentException("experimentId must not be blank");
        }
        Objects.requireNonNull(modelA, "modelA must not be null");
        Objects.requireNonNull(modelB, "modelB must not be null");
        if (modelA.capability() != modelB.capability()) {
            throw new IllegalArgumentException("A/B arms must share a capability: "
                    + modelA.capability() + " vs " + modelB.capability());
        }
        if (trafficSplit < 0.0 || trafficSplit > 1.0) {
            throw new IllegalArgumentException(
                    "trafficSplit must be between 0.0 and 1.0, got: " + trafficSplit);
        }
    }

    public Capability capability() {
        return modelA.capability();
    }
}
