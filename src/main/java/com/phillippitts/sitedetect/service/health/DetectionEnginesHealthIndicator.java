package com.phillippitts.sitedetect.service.health;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for the detection engines behind the orchestrator.
 *
 * <ul>
 *   <li>UP: every registered capability has a ready endpoint</li>
 *   <li>DEGRADED: some capabilities have a ready endpoint</li>
 *   <li>DOWN: none do</li>
 * </ul>
 *
 * <p>An endpoint is ready when its latest probe succeeded and its breaker would admit a call.
 * Exposed via /actuator/health as "detectionEngines".
 */
@Component("detectionEngines")
public class DetectionEnginesHealthIndicator implements HealthIndicator {

    private final ModelRegistry registry;
    private final EngineHealthRegistry healthRegistry;
    private final CircuitBreakerRegistry breakers;

    public DetectionEnginesHealthIndicator(ModelRegistry registry,
                                           EngineHealthRegistry healthRegistry,
                                           CircuitBreakerRegistry breakers) {
        this.registry = registry;
        this.healthRegistry = healthRegistry;
        this.breakers = breakers;
    }

    @Override
    public Health health() {
        Map<Capability, List<ModelVersion>> all = registry.listAll();
        Health.Builder builder = new Health.Builder();
        int ready = 0;
        for (Map.Entry<Capability, List<ModelVersion>> e : all.entrySet()) {
            boolean capabilityReady = e.getValue().stream()
                    .filter(ModelVersion::enabled)
                    .anyMatch(m -> healthRegistry.isHealthy(e.getKey(), m.endpoint())
                            && breakers.forEndpoint(m.endpoint()).isCallPermitted());
            if (capabilityReady) {
                ready++;
            }
            builder.withDetail(e.getKey().wireName(), capabilityReady ? "ready" : "unavailable");
        }

        if (!all.isEmpty() && ready == all.size()) {
            builder.up();
        } else if (ready > 0) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder.withDetail("readyCapabilities", ready)
                .withDetail("totalCapabilities", all.size())
                .build();
    }
}
