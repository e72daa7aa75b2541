package com.phillippitts.sitedetect.service.balancer;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.exception.NoHealthyEngineException;
import com.phillippitts.sitedetect.service.breaker.CircuitBreaker;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.health.EngineHealthRegistry;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Picks the model version (and so the endpoint) that answers one capability call.
 *
 * <p>Order of decisions:
 * <ol>
 *   <li>An enabled A/B experiment for the capability routes to model A when a uniform draw in
 *       [0, 1) is below its split, else to model B. The chosen arm must still pass its breaker.</li>
 *   <li>Otherwise the registry's enabled versions are filtered to those whose breaker would admit
 *       a call, and the configured {@link LoadBalancingStrategy} picks among them.</li>
 * </ol>
 *
 * <p>Only the chosen endpoint's breaker is asked to admit the call, so unchosen half-open
 * endpoints keep their probe slot free. Selection never retries another endpoint.
 */
public class LoadBalancer {

    private static final Logger LOG = LogManager.getLogger(LoadBalancer.class);

    private final ModelRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final EngineHealthRegistry health;
    private final LoadBalancingStrategy strategy;
    private final DoubleSupplier draw;
    private final Map<Capability, AtomicInteger> cursors = new EnumMap<>(Capability.class);

    public LoadBalancer(ModelRegistry registry, CircuitBreakerRegistry breakers,
                        EngineHealthRegistry health, LoadBalancingStrategy strategy) {
        this(registry, breakers, health, strategy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public LoadBalancer(ModelRegistry registry, CircuitBreakerRegistry breakers,
                        EngineHealthRegistry health, LoadBalancingStrategy strategy,
                        DoubleSupplier draw) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.health = Objects.requireNonNull(health, "health");
        this.strategy = strategy == null ? LoadBalancingStrategy.ROUND_ROBIN : strategy;
        this.draw = Objects.requireNonNull(draw, "draw");
        for (Capability c : Capability.values()) {
            cursors.put(c, new AtomicInteger());
        }
    }

    /**
     * Selects an engine for a capability call and admits it through the endpoint's breaker.
     *
     * @throws NoHealthyEngineException when no candidate is admitted
     * @throws com.phillippitts.sitedetect.exception.UnknownCapabilityException when nothing
     *         was ever registered for the capability
     */
    public EngineSelection select(Capability capability, DetectionRequest request) {
        Optional<ABTestConfig> experiment = registry.activeAbTest(capability);
        if (experiment.isPresent()) {
            return selectArm(capability, experiment.get());
        }

        List<ModelVersion> enabled = registry.list(capability);
        if (enabled.isEmpty()) {
            throw new NoHealthyEngineException(capability, "no enabled model versions");
        }
        List<ModelVersion> candidates = new ArrayList<>(enabled.size());
        for (ModelVersion m : enabled) {
            if (breakers.forEndpoint(m.endpoint()).isCallPermitted()) {
                candidates.add(m);
            }
        }
        if (candidates.isEmpty()) {
            throw new NoHealthyEngineException(capability, "all " + enabled.size() + " endpoints circuit-open");
        }

        ModelVersion chosen = switch (strategy) {
            case ROUND_ROBIN -> roundRobin(capability, candidates);
            case WEIGHTED -> weighted(capability, candidates);
            case LEAST_LATENCY -> leastLatency(capability, candidates);
        };
        admit(capability, chosen);
        LOG.debug("Selected {} for {} via {} ({} candidates)", chosen.key(), capability, strategy,
                candidates.size());
        return new EngineSelection(chosen, null);
    }

    /** Strategy applied when no experiment overrides balancing. */
    public LoadBalancingStrategy strategy() {
        return strategy;
    }

    private EngineSelection selectArm(Capability capability, ABTestConfig test) {
        ModelVersion arm = draw.getAsDouble() < test.trafficSplit() ? test.modelA() : test.modelB();
        admit(capability, arm);
        LOG.debug("Experiment {} routed {} to {}", test.experimentId(), capability, arm.key());
        return new EngineSelection(arm, test.experimentId());
    }

    private void admit(Capability capability, ModelVersion model) {
        CircuitBreaker breaker = breakers.forEndpoint(model.endpoint());
        if (!breaker.allowRequest()) {
            throw new NoHealthyEngineException(capability,
                    "circuit open for " + model.key() + " (state=" + breaker.getState() + ")");
        }
    }

    private ModelVersion roundRobin(Capability capability, List<ModelVersion> candidates) {
        int i = cursors.get(capability).getAndIncrement();
        return candidates.get(Math.floorMod(i, candidates.size()));
    }

    /** Draw proportional to 1 / (latency + 1); unprobed endpoints count as 0 ms. */
    private ModelVersion weighted(Capability capability, List<ModelVersion> candidates) {
        double[] weights = new double[candidates.size()];
        double total = 0.0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = 1.0 / (latency(capability, candidates.get(i)) + 1.0);
            total += weights[i];
        }
        double r = draw.getAsDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            r -= weights[i];
            if (r < 0) {
                return candidates.get(i);
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    /** Lowest probe latency wins; ties keep registration order. */
    private ModelVersion leastLatency(Capability capability, List<ModelVersion> candidates) {
        ModelVersion best = candidates.get(0);
        long bestMs = latency(capability, best);
        for (int i = 1; i < candidates.size(); i++) {
            long ms = latency(capability, candidates.get(i));
            if (ms < bestMs) {
                best = candidates.get(i);
                bestMs = ms;
            }
        }
        return best;
    }

    private long latency(Capability capability, ModelVersion model) {
        OptionalLong ms = health.responseTimeMs(capability, model.endpoint());
        return ms.orElse(0L);
    }
}
