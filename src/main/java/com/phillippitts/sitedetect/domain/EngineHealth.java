package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Point-in-time view of one engine endpoint's health for a capability.
 *
 * @param capability capability served by the endpoint
 * @param endpoint engine base URL
 * @param healthy result of the most recent liveness probe (true before the first probe)
 * @param lastCheckTime time of the most recent probe, null if never probed
 * @param lastResponseTimeMs response time of the most recent probe, null if never probed
 * @param errorCount total failed probes since startup
 * @param consecutiveFailures failed probes since the last successful one
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EngineHealth(
        Capability capability,
        String endpoint,
        boolean healthy,
        Instant lastCheckTime,
        Long lastResponseTimeMs,
        long errorCount,
        int consecutiveFailures
) {}
