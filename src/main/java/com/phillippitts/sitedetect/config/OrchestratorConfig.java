package com.phillippitts.sitedetect.config;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.service.balancer.LoadBalancer;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.dispatch.DefaultRequestDispatcher;
import com.phillippitts.sitedetect.service.dispatch.RequestDispatcher;
import com.phillippitts.sitedetect.service.engine.CapabilityParameterTable;
import com.phillippitts.sitedetect.service.engine.InferenceEngineClient;
import com.phillippitts.sitedetect.service.health.EngineHealthRegistry;
import com.phillippitts.sitedetect.service.health.HealthMonitor;
import com.phillippitts.sitedetect.service.history.RequestHistory;
import com.phillippitts.sitedetect.service.metrics.MetricsCollector;
import com.phillippitts.sitedetect.service.orchestration.DefaultDetectionOrchestrator;
import com.phillippitts.sitedetect.service.orchestration.DetectionOrchestrator;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Assembles the orchestrator from explicit per-key state holders. Every collaborator is a
 * singleton bean owned by the context; nothing is static, so tests can build several
 * independent orchestrators.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Registry seeded from {@code orchestrator.models} and {@code orchestrator.ab-tests}.
     * An experiment naming an unregistered model fails startup.
     */
    @Bean
    public ModelRegistry modelRegistry(OrchestratorProperties props) {
        ModelRegistry registry = new ModelRegistry();
        for (OrchestratorProperties.ModelDefinition def : props.getModels()) {
            registry.register(def.toModelVersion());
        }
        for (OrchestratorProperties.AbTestDefinition def : props.getAbTests()) {
            ModelVersion a = registry.findByKey(def.getModelA()).orElseThrow(() ->
                    new IllegalStateException("A/B test " + def.getExperimentId()
                            + " references unknown model " + def.getModelA()));
            ModelVersion b = registry.findByKey(def.getModelB()).orElseThrow(() ->
                    new IllegalStateException("A/B test " + def.getExperimentId()
                            + " references unknown model " + def.getModelB()));
            registry.createAbTest(new ABTestConfig(def.getExperimentId(), a, b, def.getTrafficSplit(),
                    def.isEnabled()));
        }
        LOG.info("Model registry seeded with {} models and {} experiments",
                props.getModels().size(), props.getAbTests().size());
        return registry;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(OrchestratorProperties props, Clock clock,
                                                         ApplicationEventPublisher publisher) {
        return new CircuitBreakerRegistry(props, clock, publisher);
    }

    @Bean
    public EngineHealthRegistry engineHealthRegistry(MeterRegistry meterRegistry) {
        return new EngineHealthRegistry(meterRegistry);
    }

    @Bean
    public LoadBalancer loadBalancer(ModelRegistry registry, CircuitBreakerRegistry breakers,
                                     EngineHealthRegistry health, OrchestratorProperties props) {
        return new LoadBalancer(registry, breakers, health, props.getStrategy());
    }

    @Bean
    public CapabilityParameterTable capabilityParameterTable() {
        return new CapabilityParameterTable();
    }

    @Bean
    public MetricsCollector metricsCollector(MeterRegistry meterRegistry, OrchestratorProperties props) {
        return new MetricsCollector(meterRegistry, props.getMetricsWindowSize());
    }

    @Bean
    public RequestHistory requestHistory(OrchestratorProperties props) {
        return new RequestHistory(props.getHistoryCapacity());
    }

    @Bean
    public RequestDispatcher requestDispatcher(LoadBalancer balancer,
                                               CircuitBreakerRegistry breakers,
                                               InferenceEngineClient client,
                                               CapabilityParameterTable parameters,
                                               MetricsCollector metrics,
                                               RequestHistory history,
                                               @Qualifier("detectionExecutor") ThreadPoolTaskExecutor executor,
                                               OrchestratorProperties props,
                                               Clock clock) {
        return new DefaultRequestDispatcher(balancer, breakers, client, parameters, metrics, history,
                executor, props, clock);
    }

    @Bean
    public HealthMonitor healthMonitor(ModelRegistry registry,
                                       InferenceEngineClient client,
                                       EngineHealthRegistry health,
                                       CircuitBreakerRegistry breakers,
                                       @Qualifier("healthExecutor") ThreadPoolTaskExecutor executor,
                                       @Qualifier("healthScheduler") TaskScheduler scheduler,
                                       OrchestratorProperties props,
                                       Clock clock) {
        return new HealthMonitor(registry, client, health, breakers, executor, scheduler, props, clock);
    }

    @Bean
    public DetectionOrchestrator detectionOrchestrator(ModelRegistry registry,
                                                       RequestDispatcher dispatcher,
                                                       EngineHealthRegistry health,
                                                       MetricsCollector metrics,
                                                       RequestHistory history) {
        return new DefaultDetectionOrchestrator(registry, dispatcher, health, metrics, history);
    }
}
