package com.phillippitts.sitedetect.service.balancer;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.exception.NoHealthyEngineException;
import com.phillippitts.sitedetect.exception.UnknownCapabilityException;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.health.EngineHealthFixtures;
import com.phillippitts.sitedetect.service.health.EngineHealthRegistry;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import com.phillippitts.sitedetect.testutil.EventCapturingPublisher;
import com.phillippitts.sitedetect.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadBalancerTest {

    private static final DetectionRequest REQUEST =
            DetectionRequest.of(UUID.randomUUID(), "s3://photos/1.jpg", Capability.DAMAGE);

    private final MutableClock clock = new MutableClock();
    private final ModelRegistry registry = new ModelRegistry();
    private final CircuitBreakerRegistry breakers =
            new CircuitBreakerRegistry(1, Duration.ofSeconds(60), clock, new EventCapturingPublisher());
    private final EngineHealthRegistry health = new EngineHealthRegistry(new SimpleMeterRegistry());

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5})
    void shouldVisitEachEndpointOncePerRoundRobinCycle(int k) {
        for (int i = 0; i < k; i++) {
            registry.register(damage("m" + i, "http://e" + i + ":1"));
        }
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        for (int cycle = 0; cycle < 4; cycle++) {
            HashSet<String> seen = new HashSet<>();
            for (int i = 0; i < k; i++) {
                seen.add(balancer.select(Capability.DAMAGE, REQUEST).endpoint());
            }
            assertThat(seen).hasSize(k);
        }
    }

    @Test
    void shouldRouteTrafficSplitToModelA() {
        ModelVersion a = damage("damage", "http://a:1");
        ModelVersion b = new ModelVersion("damage", "v2", Capability.DAMAGE, "http://b:1", 0.75, true);
        registry.register(a);
        registry.register(b);
        registry.createAbTest(new ABTestConfig("exp-1", a, b, 0.3, true));
        Random random = new Random(42);
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health,
                LoadBalancingStrategy.ROUND_ROBIN, random::nextDouble);

        int trials = 10_000;
        int toA = 0;
        for (int i = 0; i < trials; i++) {
            EngineSelection s = balancer.select(Capability.DAMAGE, REQUEST);
            assertThat(s.experimentId()).isEqualTo("exp-1");
            if (s.endpoint().equals("http://a:1")) {
                toA++;
            }
        }

        assertThat((double) toA / trials).isBetween(0.28, 0.32);
    }

    @Test
    void shouldFailWhenExperimentArmIsCircuitOpen() {
        ModelVersion a = damage("damage", "http://a:1");
        ModelVersion b = new ModelVersion("damage", "v2", Capability.DAMAGE, "http://b:1", 0.75, true);
        registry.register(a);
        registry.createAbTest(new ABTestConfig("exp-1", a, b, 1.0, true));
        breakers.forEndpoint("http://a:1").recordFailure();
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health,
                LoadBalancingStrategy.ROUND_ROBIN, () -> 0.0);

        assertThatThrownBy(() -> balancer.select(Capability.DAMAGE, REQUEST))
                .isInstanceOf(NoHealthyEngineException.class)
                .hasMessageContaining("circuit open");
    }

    @Test
    void shouldSkipCircuitOpenEndpoints() {
        registry.register(damage("m0", "http://e0:1"));
        registry.register(damage("m1", "http://e1:1"));
        breakers.forEndpoint("http://e0:1").recordFailure();
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        for (int i = 0; i < 5; i++) {
            assertThat(balancer.select(Capability.DAMAGE, REQUEST).endpoint()).isEqualTo("http://e1:1");
        }
    }

    @Test
    void shouldThrowNoHealthyEngineWhenAllOpen() {
        registry.register(damage("m0", "http://e0:1"));
        breakers.forEndpoint("http://e0:1").recordFailure();
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        assertThatThrownBy(() -> balancer.select(Capability.DAMAGE, REQUEST))
                .isInstanceOf(NoHealthyEngineException.class);
    }

    @Test
    void shouldThrowNoHealthyEngineWhenAllDisabled() {
        registry.register(new ModelVersion("m0", "v1", Capability.DAMAGE, "http://e0:1", 0.75, false));
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        assertThatThrownBy(() -> balancer.select(Capability.DAMAGE, REQUEST))
                .isInstanceOf(NoHealthyEngineException.class)
                .hasMessageContaining("no enabled");
    }

    @Test
    void shouldPropagateUnknownCapability() {
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        assertThatThrownBy(() -> balancer.select(Capability.VOLUME, REQUEST))
                .isInstanceOf(UnknownCapabilityException.class);
    }

    @Test
    void shouldGiveHalfOpenProbeSlotToChosenEndpointOnly() {
        registry.register(damage("m0", "http://e0:1"));
        registry.register(damage("m1", "http://e1:1"));
        breakers.forEndpoint("http://e0:1").recordFailure();
        breakers.forEndpoint("http://e1:1").recordFailure();
        clock.advance(Duration.ofSeconds(60));
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        String first = balancer.select(Capability.DAMAGE, REQUEST).endpoint();
        String second = balancer.select(Capability.DAMAGE, REQUEST).endpoint();

        assertThat(first).isNotEqualTo(second);
        assertThatThrownBy(() -> balancer.select(Capability.DAMAGE, REQUEST))
                .isInstanceOf(NoHealthyEngineException.class);
    }

    @Test
    void shouldPreferLowestProbeLatency() {
        registry.register(damage("slow", "http://slow:1"));
        registry.register(damage("fast", "http://fast:1"));
        recordProbe("http://slow:1", 400);
        recordProbe("http://fast:1", 20);
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.LEAST_LATENCY);

        for (int i = 0; i < 3; i++) {
            assertThat(balancer.select(Capability.DAMAGE, REQUEST).endpoint()).isEqualTo("http://fast:1");
        }
    }

    @Test
    void shouldWeightTowardsFasterEndpoint() {
        registry.register(damage("slow", "http://slow:1"));
        registry.register(damage("fast", "http://fast:1"));
        recordProbe("http://slow:1", 99);
        recordProbe("http://fast:1", 0);
        AtomicReference<Double> next = new AtomicReference<>(0.5);
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health,
                LoadBalancingStrategy.WEIGHTED, next::get);

        // weights 0.01 and 1.0: only a draw in the first ~1% picks the slow endpoint
        assertThat(balancer.select(Capability.DAMAGE, REQUEST).endpoint()).isEqualTo("http://fast:1");
        next.set(0.001);
        assertThat(balancer.select(Capability.DAMAGE, REQUEST).endpoint()).isEqualTo("http://slow:1");
    }

    @Test
    void shouldKeepRoundRobinCursorsPerCapability() {
        registry.register(damage("d0", "http://d0:1"));
        registry.register(damage("d1", "http://d1:1"));
        registry.register(new ModelVersion("mat", "v1", Capability.MATERIAL, "http://m0:1", 0.75, true));
        LoadBalancer balancer = new LoadBalancer(registry, breakers, health, LoadBalancingStrategy.ROUND_ROBIN);

        List<String> picks = new ArrayList<>();
        picks.add(balancer.select(Capability.DAMAGE, REQUEST).endpoint());
        balancer.select(Capability.MATERIAL, REQUEST);
        picks.add(balancer.select(Capability.DAMAGE, REQUEST).endpoint());

        assertThat(picks).containsExactly("http://d0:1", "http://d1:1");
    }

    private void recordProbe(String endpoint, long ms) {
        EngineHealthFixtures.recordSuccess(health, Capability.DAMAGE, endpoint, ms, clock.instant());
    }

    private static ModelVersion damage(String name, String endpoint) {
        return new ModelVersion(name, "v1", Capability.DAMAGE, endpoint, 0.75, true);
    }
}
