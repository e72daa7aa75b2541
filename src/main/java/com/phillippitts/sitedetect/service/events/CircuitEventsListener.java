package com.phillippitts.sitedetect.service.events;

import com.phillippitts.sitedetect.domain.CircuitBreakerState;
import com.phillippitts.sitedetect.service.breaker.CircuitStateChangedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Logs circuit breaker transitions and counts them as {@code sitedetect.circuit.transitions}.
 */
@Component
public class CircuitEventsListener {

    private static final Logger LOG = LogManager.getLogger(CircuitEventsListener.class);

    private final MeterRegistry registry;

    public CircuitEventsListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onTransition(CircuitStateChangedEvent event) {
        if (event.to() == CircuitBreakerState.OPEN) {
            LOG.warn("Circuit OPEN for {} after {} failures (was {})",
                    event.endpoint(), event.failureCount(), event.from());
        } else {
            LOG.info("Circuit {} -> {} for {}", event.from(), event.to(), event.endpoint());
        }
        Counter.builder("sitedetect.circuit.transitions")
                .description("Circuit breaker state transitions")
                .tag("endpoint", event.endpoint())
                .tag("from", event.from().name().toLowerCase(Locale.ROOT))
                .tag("to", event.to().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
