package com.phillippitts.sitedetect.service.health;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.EngineHealth;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.service.breaker.CircuitBreaker;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.engine.InferenceEngineClient;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import com.phillippitts.sitedetect.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background prober that keeps {@link EngineHealth} current and feeds circuit breakers.
 *
 * <p>Every {@code health-check-interval-seconds} each distinct (capability, endpoint) of an
 * enabled model version or enabled A/B arm gets a liveness probe on the health executor, bounded
 * by {@code health-check-timeout-ms}. Probes never run on request threads.
 *
 * <p>Breaker feedback goes through {@link CircuitBreaker#allowRequest()}: while CLOSED every
 * probe outcome is recorded; once an OPEN breaker's timeout has elapsed the probe takes the
 * half-open slot and its outcome decides the transition; otherwise only the health record is
 * updated. Probe and request failures share one failure counter.
 */
public class HealthMonitor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    record Target(Capability capability, String endpoint) {}

    private final ModelRegistry registry;
    private final InferenceEngineClient client;
    private final EngineHealthRegistry healthRegistry;
    private final CircuitBreakerRegistry breakers;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final OrchestratorProperties props;
    private final Clock clock;

    private volatile boolean running;
    private ScheduledFuture<?> schedule;

    public HealthMonitor(ModelRegistry registry,
                         InferenceEngineClient client,
                         EngineHealthRegistry healthRegistry,
                         CircuitBreakerRegistry breakers,
                         Executor healthExecutor,
                         TaskScheduler scheduler,
                         OrchestratorProperties props,
                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.client = Objects.requireNonNull(client, "client");
        this.healthRegistry = Objects.requireNonNull(healthRegistry, "healthRegistry");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.executor = Objects.requireNonNull(healthExecutor, "healthExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!props.isHealthMonitorEnabled()) {
            LOG.info("Health monitor disabled by configuration");
            return;
        }
        Duration interval = Duration.ofSeconds(props.getHealthCheckIntervalSeconds());
        schedule = scheduler.scheduleWithFixedDelay(this::runCycle, interval);
        running = true;
        LOG.info("Health monitor started (interval={}s, probeTimeout={}ms)",
                interval.toSeconds(), props.getHealthCheckTimeoutMs());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        if (schedule != null) {
            schedule.cancel(true);
            schedule = null;
        }
        running = false;
        LOG.info("Health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Probes every known endpoint once.
     *
     * @return future completing when every probe has resolved (success, failure or timeout)
     */
    public CompletableFuture<Void> probeAll() {
        List<Target> targets = targets();
        List<CompletableFuture<Void>> probes = new ArrayList<>(targets.size());
        for (Target t : targets) {
            probes.add(probe(t));
        }
        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> probe(Target target) {
        CircuitBreaker breaker = breakers.forEndpoint(target.endpoint());
        EngineHealthTracker tracker = healthRegistry.tracker(target.capability(), target.endpoint());
        boolean admitted = breaker.allowRequest();
        long t0 = System.nanoTime();
        return CompletableFuture
                .runAsync(() -> client.probe(target.capability(), target.endpoint()), executor)
                .orTimeout(props.getHealthCheckTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((ok, err) -> {
                    long ms = TimeUtils.elapsedMillis(t0);
                    if (err == null) {
                        tracker.recordSuccess(ms, clock.instant());
                        if (admitted) {
                            breaker.recordSuccess();
                        }
                        LOG.debug("Probe {} {} ok in {} ms", target.capability(), target.endpoint(), ms);
                    } else {
                        tracker.recordFailure(ms, clock.instant());
                        if (admitted) {
                            breaker.recordFailure();
                        }
                        LOG.debug("Probe {} {} failed after {} ms: {}", target.capability(),
                                target.endpoint(), ms, rootMessage(err));
                    }
                    return null;
                });
    }

    /** Distinct (capability, endpoint) pairs of enabled models and enabled A/B arms. */
    List<Target> targets() {
        Set<Target> out = new LinkedHashSet<>();
        for (Map.Entry<Capability, List<ModelVersion>> e : registry.listAll().entrySet()) {
            for (ModelVersion m : e.getValue()) {
                if (m.enabled()) {
                    out.add(new Target(e.getKey(), m.endpoint()));
                }
            }
        }
        for (ABTestConfig test : registry.listAbTests()) {
            if (test.enabled()) {
                out.add(new Target(test.capability(), test.modelA().endpoint()));
                out.add(new Target(test.capability(), test.modelB().endpoint()));
            }
        }
        return List.copyOf(out);
    }

    private void runCycle() {
        try {
            probeAll().join();
        } catch (RuntimeException e) {
            LOG.warn("Health check cycle failed: {}", e.toString());
        }
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        if (!running) {
            return;
        }
        StringBuilder sb = new StringBuilder("Engine health: ");
        healthRegistry.snapshot().forEach((cap, list) -> {
            for (EngineHealth h : list) {
                sb.append(cap).append('@').append(h.endpoint()).append('=')
                        .append(h.healthy() ? "up" : "down(" + h.consecutiveFailures() + ")").append(' ');
            }
        });
        LOG.info(sb.toString().trim());
    }

    private static String rootMessage(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) {
            c = c.getCause();
        }
        return c.getClass().getSimpleName() + (c.getMessage() == null ? "" : ": " + c.getMessage());
    }
}
