package com.phillippitts.sitedetect.service.breaker;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns one {@link CircuitBreaker} per engine endpoint.
 *
 * <p>Breakers are created lazily on first use and live for the lifetime of the process. The
 * request path and the health monitor obtain the same instance for an endpoint, so both feed
 * a single failure counter. State changes are published as {@link CircuitStateChangedEvent}s.
 */
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int threshold;
    private final Duration openTimeout;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    public CircuitBreakerRegistry(OrchestratorProperties props, Clock clock, ApplicationEventPublisher publisher) {
        this(props.getCircuitBreakerThreshold(),
                Duration.ofSeconds(props.getCircuitBreakerTimeoutSeconds()), clock, publisher);
    }

    public CircuitBreakerRegistry(int threshold, Duration openTimeout, Clock clock,
                                  ApplicationEventPublisher publisher) {
        this.threshold = threshold;
        this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /** Returns the breaker for an endpoint, creating it in CLOSED state if needed. */
    public CircuitBreaker forEndpoint(String endpoint) {
        return breakers.computeIfAbsent(endpoint, e -> new CircuitBreaker(e, threshold, openTimeout, clock,
                (ep, from, to, failures) -> publisher.publishEvent(
                        new CircuitStateChangedEvent(ep, from, to, failures, clock.instant()))));
    }

    /** Snapshots of all known breakers, sorted by endpoint. */
    public List<CircuitBreaker.Snapshot> snapshot() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreaker.Snapshot::endpoint))
                .toList();
    }
}
