package com.phillippitts.sitedetect.config.properties;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.service.balancer.LoadBalancingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed properties for the detection orchestrator (prefix {@code orchestrator}).
 *
 * <p>The model catalog defaults to one version per capability. Setting
 * {@code orchestrator.models[0].*} in configuration replaces the whole list.
 */
@Validated
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    @NotNull
    private LoadBalancingStrategy strategy = LoadBalancingStrategy.ROUND_ROBIN;

    /** Failures counted while CLOSED before the breaker opens. */
    @Min(value = 1, message = "Circuit breaker threshold must be at least 1")
    private int circuitBreakerThreshold = 5;

    /** Seconds an OPEN breaker waits before allowing a half-open probe. */
    @Min(value = 1, message = "Circuit breaker timeout must be at least 1 second")
    private int circuitBreakerTimeoutSeconds = 60;

    @Min(value = 1, message = "Health check interval must be at least 1 second")
    private int healthCheckIntervalSeconds = 30;

    @Positive
    private long healthCheckTimeoutMs = 2_000;

    private boolean healthMonitorEnabled = true;

    /** Default deadline for a single capability call. */
    @Positive
    private long engineTimeoutMs = 5_000;

    /** Optional per-capability deadline overrides. */
    private Map<Capability, Long> capabilityTimeoutsMs = new EnumMap<>(Capability.class);

    /** Overall caller deadline for one submit call. */
    @Positive
    private long requestTimeoutMs = 30_000;

    @Positive
    private int historyCapacity = 1_000;

    @Positive
    private int metricsWindowSize = 1_000;

    @Valid
    private List<ModelDefinition> models = defaultModels();

    @Valid
    private List<AbTestDefinition> abTests = new ArrayList<>();

    /**
     * Resolves the call deadline for a capability, falling back to {@link #getEngineTimeoutMs()}.
     */
    public long timeoutFor(Capability capability) {
        Long override = capabilityTimeoutsMs.get(capability);
        return override != null && override > 0 ? override : engineTimeoutMs;
    }

    /** Longest per-capability deadline; used to size HTTP read timeouts. */
    public long maxEngineTimeoutMs() {
        long max = engineTimeoutMs;
        for (Long v : capabilityTimeoutsMs.values()) {
            if (v != null && v > max) {
                max = v;
            }
        }
        return max;
    }

    private static List<ModelDefinition> defaultModels() {
        List<ModelDefinition> list = new ArrayList<>();
        list.add(new ModelDefinition("damage-detector", "v1.2.0", Capability.DAMAGE,
                "http://damage-engine:8001", 0.75));
        list.add(new ModelDefinition("material-detector", "v1.1.0", Capability.MATERIAL,
                "http://material-engine:8002", 0.75));
        list.add(new ModelDefinition("volume-estimator", "v1.0.0", Capability.VOLUME,
                "http://volume-engine:8003", 0.70));
        return list;
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(LoadBalancingStrategy strategy) {
        this.strategy = strategy;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(int circuitBreakerThreshold) {
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public int getCircuitBreakerTimeoutSeconds() {
        return circuitBreakerTimeoutSeconds;
    }

    public void setCircuitBreakerTimeoutSeconds(int circuitBreakerTimeoutSeconds) {
        this.circuitBreakerTimeoutSeconds = circuitBreakerTimeoutSeconds;
    }

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    }

    public long getHealthCheckTimeoutMs() {
        return healthCheckTimeoutMs;
    }

    public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) {
        this.healthCheckTimeoutMs = healthCheckTimeoutMs;
    }

    public boolean isHealthMonitorEnabled() {
        return healthMonitorEnabled;
    }

    public void setHealthMonitorEnabled(boolean healthMonitorEnabled) {
        this.healthMonitorEnabled = healthMonitorEnabled;
    }

    public long getEngineTimeoutMs() {
        return engineTimeoutMs;
    }

    public void setEngineTimeoutMs(long engineTimeoutMs) {
        this.engineTimeoutMs = engineTimeoutMs;
    }

    public Map<Capability, Long> getCapabilityTimeoutsMs() {
        return capabilityTimeoutsMs;
    }

    public void setCapabilityTimeoutsMs(Map<Capability, Long> capabilityTimeoutsMs) {
        this.capabilityTimeoutsMs = capabilityTimeoutsMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getMetricsWindowSize() {
        return metricsWindowSize;
    }

    public void setMetricsWindowSize(int metricsWindowSize) {
        this.metricsWindowSize = metricsWindowSize;
    }

    public List<ModelDefinition> getModels() {
        return models;
    }

    public void setModels(List<ModelDefinition> models) {
        this.models = models;
    }

    public List<AbTestDefinition> getAbTests() {
        return abTests;
    }

    public void setAbTests(List<AbTestDefinition> abTests) {
        this.abTests = abTests;
    }

    /**
     * One entry of the boot-time model catalog.
     */
    public static class ModelDefinition {
        @NotBlank
        private String name;
        @NotBlank
        private String version;
        @NotNull
        private Capability capability;
        @NotBlank
        private String endpoint;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.75;
        private boolean enabled = true;

        public ModelDefinition() {
        }

        public ModelDefinition(String name, String version, Capability capability,
                               String endpoint, double confidenceThreshold) {
            this.name = name;
            this.version = version;
            this.capability = capability;
            this.endpoint = endpoint;
            this.confidenceThreshold = confidenceThreshold;
        }

        public ModelVersion toModelVersion() {
            return new ModelVersion(name, version, capability, endpoint, confidenceThreshold, enabled);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public Capability getCapability() {
            return capability;
        }

        public void setCapability(Capability capability) {
            this.capability = capability;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Boot-time A/B experiment. Arms reference registered models as {@code name:version}.
     */
    public static class AbTestDefinition {
        @NotBlank
        private String experimentId;
        @NotBlank
        private String modelA;
        @NotBlank
        private String modelB;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double trafficSplit = 0.5;
        private boolean enabled = true;

        public String getExperimentId() {
            return experimentId;
        }

        public void setExperimentId(String experimentId) {
            this.experimentId = experimentId;
        }

        public String getModelA() {
            return modelA;
        }

        public void setModelA(String modelA) {
            this.modelA = modelA;
        }

        public String getModelB() {
            return modelB;
        }

        public void setModelB(String modelB) {
            this.modelB = modelB;
        }

        public double getTrafficSplit() {
            return trafficSplit;
        }

        public void setTrafficSplit(double trafficSplit) {
            this.trafficSplit = trafficSplit;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
