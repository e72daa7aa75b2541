package com.phillippitts.sitedetect.service.health;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.EngineHealth;

import java.time.Instant;

/**
 * Mutable health record for one (capability, endpoint) pair, updated in place by the
 * health monitor and read by the load balancer. Never recreated for the life of the process.
 */
public final class EngineHealthTracker {

    private final Capability capability;
    private final String endpoint;

    private boolean healthy = true;
    private Instant lastCheckTime;
    private Long lastResponseTimeMs;
    private long errorCount;
    private int consecutiveFailures;

    EngineHealthTracker(Capability capability, String endpoint) {
        this.capability = capability;
        this.endpoint = endpoint;
    }

    synchronized void recordSuccess(long responseTimeMs, Instant at) {
        healthy = true;
        lastCheckTime = at;
        lastResponseTimeMs = responseTimeMs;
        consecutiveFailures = 0;
    }

    synchronized void recordFailure(long responseTimeMs, Instant at) {
        healthy = false;
        lastCheckTime = at;
        lastResponseTimeMs = responseTimeMs;
        errorCount++;
        consecutiveFailures++;
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    /** Response time of the latest probe, or null before the first probe. */
    public synchronized Long lastResponseTimeMs() {
        return lastResponseTimeMs;
    }

    public synchronized EngineHealth snapshot() {
        return new EngineHealth(capability, endpoint, healthy, lastCheckTime, lastResponseTimeMs,
                errorCount, consecutiveFailures);
    }

    public Capability capability() {
        return capability;
    }

    public String endpoint() {
        return endpoint;
    }
}
