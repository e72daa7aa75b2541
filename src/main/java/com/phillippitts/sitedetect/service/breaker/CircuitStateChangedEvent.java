package com.phillippitts.sitedetect.service.breaker;

import com.phillippitts.sitedetect.domain.CircuitBreakerState;

import java.time.Instant;

/**
 * Published whenever an endpoint's circuit breaker changes state.
 *
 * @param endpoint engine base URL
 * @param from previous state
 * @param to new state
 * @param failureCount failure count at the time of the transition
 * @param at transition time
 */
public record CircuitStateChangedEvent(
        String endpoint,
        CircuitBreakerState from,
        CircuitBreakerState to,
        int failureCount,
        Instant at
) {}
