package com.phillippitts.sitedetect.service.orchestration;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.EngineHealth;
import com.phillippitts.sitedetect.domain.HealthSummary;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.domain.OrchestratorMetrics;
import com.phillippitts.sitedetect.exception.InvalidDetectionRequestException;
import com.phillippitts.sitedetect.service.dispatch.RequestDispatcher;
import com.phillippitts.sitedetect.service.health.EngineHealthRegistry;
import com.phillippitts.sitedetect.service.history.RequestHistory;
import com.phillippitts.sitedetect.service.metrics.MetricsCollector;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Wires registry, dispatcher, health, metrics and history into the caller-facing operations.
 *
 * <p>Health covers every enabled model endpoint; endpoints not yet probed are reported as
 * healthy with no check time.
 */
public class DefaultDetectionOrchestrator implements DetectionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultDetectionOrchestrator.class);

    private final ModelRegistry registry;
    private final RequestDispatcher dispatcher;
    private final EngineHealthRegistry health;
    private final MetricsCollector metrics;
    private final RequestHistory history;

    public DefaultDetectionOrchestrator(ModelRegistry registry,
                                        RequestDispatcher dispatcher,
                                        EngineHealthRegistry health,
                                        MetricsCollector metrics,
                                        RequestHistory history) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.health = Objects.requireNonNull(health, "health");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.history = Objects.requireNonNull(history, "history");
    }

    @Override
    public DetectionResponse submit(DetectionRequest request, String correlationId) {
        validate(request);
        return dispatcher.process(request, correlationId);
    }

    @Override
    public DetectionResponse getStatus(UUID requestId) {
        if (requestId == null) {
            throw new InvalidDetectionRequestException("requestId is required");
        }
        return history.get(requestId);
    }

    @Override
    public HealthSummary getHealth() {
        Map<Capability, List<EngineHealth>> engines = new EnumMap<>(Capability.class);
        registry.listAll().forEach((capability, versions) -> {
            List<EngineHealth> list = new ArrayList<>();
            versions.stream()
                    .filter(ModelVersion::enabled)
                    .map(ModelVersion::endpoint)
                    .distinct()
                    .forEach(endpoint -> list.add(health.tracker(capability, endpoint).snapshot()));
            engines.put(capability, List.copyOf(list));
        });
        return HealthSummary.of(engines);
    }

    @Override
    public OrchestratorMetrics getMetrics() {
        return metrics.snapshot();
    }

    @Override
    public Map<Capability, List<ModelVersion>> listModels() {
        return registry.listAll();
    }

    @Override
    public ABTestConfig createAbTest(String experimentId, String modelAKey, String modelBKey,
                                     double trafficSplit, boolean enabled) {
        ModelVersion a = registry.findByKey(modelAKey)
                .orElseThrow(() -> new InvalidDetectionRequestException("Unknown model " + modelAKey));
        ModelVersion b = registry.findByKey(modelBKey)
                .orElseThrow(() -> new InvalidDetectionRequestException("Unknown model " + modelBKey));
        ABTestConfig config;
        try {
            config = new ABTestConfig(experimentId, a, b, trafficSplit, enabled);
        } catch (IllegalArgumentException e) {
            throw new InvalidDetectionRequestException(e.getMessage());
        }
        registry.createAbTest(config);
        return config;
    }

    @Override
    public List<ABTestConfig> listAbTests() {
        return registry.listAbTests();
    }

    @Override
    public boolean setModelEnabled(Capability capability, String name, String version, boolean enabled) {
        return registry.setEnabled(capability, name, version, enabled);
    }

    private static void validate(DetectionRequest request) {
        if (request == null) {
            throw new InvalidDetectionRequestException("request body is required");
        }
        if (request.photoId() == null) {
            throw new InvalidDetectionRequestException("photo_id is required");
        }
        if (request.photoUrl() == null || request.photoUrl().isBlank()) {
            throw new InvalidDetectionRequestException("photo_url must not be blank");
        }
        LOG.debug("Accepted request for photo {}", request.photoId());
    }
}
