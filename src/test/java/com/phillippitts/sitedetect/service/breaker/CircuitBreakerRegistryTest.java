package com.phillippitts.sitedetect.service.breaker;

import com.phillippitts.sitedetect.domain.CircuitBreakerState;
import com.phillippitts.sitedetect.testutil.EventCapturingPublisher;
import com.phillippitts.sitedetect.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = new MutableClock();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final CircuitBreakerRegistry registry =
            new CircuitBreakerRegistry(2, Duration.ofSeconds(10), clock, publisher);

    @Test
    void shouldReturnSameBreakerPerEndpoint() {
        CircuitBreaker a = registry.forEndpoint("http://a:1");
        CircuitBreaker b = registry.forEndpoint("http://b:1");

        assertThat(registry.forEndpoint("http://a:1")).isSameAs(a);
        assertThat(b).isNotSameAs(a);
    }

    @Test
    void shouldPublishTransitionEvents() {
        CircuitBreaker breaker = registry.forEndpoint("http://a:1");
        breaker.recordFailure();
        breaker.recordFailure();

        List<CircuitStateChangedEvent> events = publisher.eventsOfType(CircuitStateChangedEvent.class);
        assertThat(events).hasSize(1);
        CircuitStateChangedEvent e = events.get(0);
        assertThat(e.endpoint()).isEqualTo("http://a:1");
        assertThat(e.from()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(e.to()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(e.failureCount()).isEqualTo(2);
        assertThat(e.at()).isEqualTo(clock.instant());
    }

    @Test
    void shouldSnapshotSortedByEndpoint() {
        registry.forEndpoint("http://z:1");
        registry.forEndpoint("http://a:1").recordFailure();

        List<CircuitBreaker.Snapshot> snapshot = registry.snapshot();

        assertThat(snapshot).extracting(CircuitBreaker.Snapshot::endpoint)
                .containsExactly("http://a:1", "http://z:1");
        assertThat(snapshot.get(0).failureCount()).isEqualTo(1);
    }
}
