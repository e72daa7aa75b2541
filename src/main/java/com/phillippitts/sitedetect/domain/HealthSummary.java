package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Aggregate health of all monitored engines.
 *
 * @param status "healthy" when every endpoint is healthy, "degraded" otherwise
 * @param totalEngines number of monitored (capability, endpoint) pairs
 * @param healthyEngines number of those currently healthy
 * @param engines per-capability health records
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthSummary(
        String status,
        int totalEngines,
        int healthyEngines,
        Map<Capability, List<EngineHealth>> engines
) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public static HealthSummary of(Map<Capability, List<EngineHealth>> engines) {
        int total = 0;
        int healthy = 0;
        for (List<EngineHealth> list : engines.values()) {
            for (EngineHealth h : list) {
                total++;
                if (h.healthy()) {
                    healthy++;
                }
            }
        }
        return new HealthSummary(healthy == total ? HEALTHY : DEGRADED, total, healthy, engines);
    }
}
