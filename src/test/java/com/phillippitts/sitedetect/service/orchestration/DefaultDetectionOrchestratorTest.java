package com.phillippitts.sitedetect.service.orchestration;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.HealthSummary;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.exception.InvalidDetectionRequestException;
import com.phillippitts.sitedetect.exception.RequestNotFoundException;
import com.phillippitts.sitedetect.service.balancer.LoadBalancer;
import com.phillippitts.sitedetect.service.balancer.LoadBalancingStrategy;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.dispatch.DefaultRequestDispatcher;
import com.phillippitts.sitedetect.service.dispatch.RequestDispatcher;
import com.phillippitts.sitedetect.service.engine.CapabilityParameterTable;
import com.phillippitts.sitedetect.service.health.EngineHealthFixtures;
import com.phillippitts.sitedetect.service.health.EngineHealthRegistry;
import com.phillippitts.sitedetect.service.history.RequestHistory;
import com.phillippitts.sitedetect.service.metrics.MetricsCollector;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import com.phillippitts.sitedetect.testutil.EventCapturingPublisher;
import com.phillippitts.sitedetect.testutil.FakeInferenceEngineClient;
import com.phillippitts.sitedetect.testutil.MutableClock;
import com.phillippitts.sitedetect.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DefaultDetectionOrchestratorTest {

    private final MutableClock clock = new MutableClock();
    private final ModelRegistry registry = new ModelRegistry();
    private final EngineHealthRegistry health = new EngineHealthRegistry(new SimpleMeterRegistry());
    private final MetricsCollector metrics = new MetricsCollector(new SimpleMeterRegistry(), 100);
    private final RequestHistory history = new RequestHistory(10);

    private DefaultDetectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry.register(new ModelVersion("damage", "v1", Capability.DAMAGE, "http://d1:1", 0.75, true));
        registry.register(new ModelVersion("damage", "v2", Capability.DAMAGE, "http://d2:1", 0.75, true));
        registry.register(new ModelVersion("material", "v1", Capability.MATERIAL, "http://m1:1", 0.75, true));
        CircuitBreakerRegistry breakers =
                new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock, new EventCapturingPublisher());
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);
        RequestDispatcher dispatcher = new DefaultRequestDispatcher(balancer, breakers,
                new FakeInferenceEngineClient(), new CapabilityParameterTable(), metrics, history,
                new SyncExecutor(), new OrchestratorProperties(), clock);
        orchestrator = new DefaultDetectionOrchestrator(registry, dispatcher, health, metrics, history);
    }

    @Test
    void shouldReturnSameResponseFromStatusLookup() {
        DetectionResponse submitted = orchestrator.submit(
                DetectionRequest.of(UUID.randomUUID(), "s3://p.jpg"), null);

        assertThat(orchestrator.getStatus(submitted.requestId())).isSameAs(submitted);
        assertThat(orchestrator.getMetrics().totalRequests()).isEqualTo(1);
    }

    @Test
    void shouldThrowNotFoundForUnknownRequest() {
        assertThatThrownBy(() -> orchestrator.getStatus(UUID.randomUUID()))
                .isInstanceOf(RequestNotFoundException.class);
    }

    @Test
    void shouldRejectInvalidRequestsBeforeDispatch() {
        RequestDispatcher dispatcher = mock(RequestDispatcher.class);
        DefaultDetectionOrchestrator o = new DefaultDetectionOrchestrator(registry, dispatcher, health, metrics, history);

        assertThatThrownBy(() -> o.submit(null, null)).isInstanceOf(InvalidDetectionRequestException.class);
        assertThatThrownBy(() -> o.submit(new DetectionRequest(null, "s3://p.jpg", Set.of(), null, Map.of()), null))
                .isInstanceOf(InvalidDetectionRequestException.class)
                .hasMessageContaining("photo_id");
        assertThatThrownBy(() -> o.submit(new DetectionRequest(UUID.randomUUID(), "  ", Set.of(), null, Map.of()), null))
                .isInstanceOf(InvalidDetectionRequestException.class)
                .hasMessageContaining("photo_url");
        verify(dispatcher, never()).process(any(), any());
    }

    @Test
    void shouldSummarizeHealthOfEnabledEndpoints() {
        EngineHealthFixtures.recordFailure(health, Capability.DAMAGE, "http://d2:1", 12, clock.instant());

        HealthSummary summary = orchestrator.getHealth();

        assertThat(summary.status()).isEqualTo(HealthSummary.DEGRADED);
        assertThat(summary.totalEngines()).isEqualTo(3);
        assertThat(summary.healthyEngines()).isEqualTo(2);
        assertThat(summary.engines().get(Capability.DAMAGE)).hasSize(2);
    }

    @Test
    void shouldReportHealthyWhenNothingFailed() {
        assertThat(orchestrator.getHealth().status()).isEqualTo(HealthSummary.HEALTHY);
    }

    @Test
    void shouldCreateExperimentFromModelKeys() {
        ABTestConfig config = orchestrator.createAbTest("exp-1", "damage:v1", "damage:v2", 0.2, true);

        assertThat(config.capability()).isEqualTo(Capability.DAMAGE);
        assertThat(orchestrator.listAbTests()).containsExactly(config);
    }

    @Test
    void shouldRejectExperimentWithUnknownModel() {
        assertThatThrownBy(() -> orchestrator.createAbTest("exp-1", "damage:v1", "damage:v9", 0.5, true))
                .isInstanceOf(InvalidDetectionRequestException.class)
                .hasMessageContaining("damage:v9");
    }

    @Test
    void shouldRejectExperimentAcrossCapabilities() {
        assertThatThrownBy(() -> orchestrator.createAbTest("exp-1", "damage:v1", "material:v1", 0.5, true))
                .isInstanceOf(InvalidDetectionRequestException.class)
                .hasMessageContaining("share a capability");
    }

    @Test
    void shouldToggleModels() {
        assertThat(orchestrator.setModelEnabled(Capability.DAMAGE, "damage", "v2", false)).isTrue();
        assertThat(orchestrator.listModels().get(Capability.DAMAGE))
                .filteredOn(ModelVersion::enabled)
                .extracting(ModelVersion::version)
                .containsExactly("v1");
    }
}
