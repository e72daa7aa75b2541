package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Rolling statistics derived on demand from the metrics sample windows.
 *
 * <p>Request-level figures cover the most recent completed requests; per-engine figures
 * cover the most recent calls per capability.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrchestratorMetrics(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long partialRequests,
        double avgLatencyMs,
        double p50LatencyMs,
        double p90LatencyMs,
        double p95LatencyMs,
        double errorRate,
        Map<Capability, EngineMetrics> engineMetrics
) {

    public static OrchestratorMetrics empty() {
        return new OrchestratorMetrics(0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, Map.of());
    }

    /**
     * Per-capability call statistics.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EngineMetrics(
            long totalRequests,
            long errorCount,
            double errorRate,
            double avgConfidence,
            double avgLatencyMs,
            double p50LatencyMs,
            double p90LatencyMs,
            double p95LatencyMs
    ) {}
}
