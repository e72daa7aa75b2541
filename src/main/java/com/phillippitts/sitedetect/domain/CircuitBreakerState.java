package com.phillippitts.sitedetect.domain;

/**
 * Circuit breaker states.
 *
 * <ul>
 *   <li>CLOSED - calls flow, failures are counted</li>
 *   <li>OPEN - calls are rejected without touching the engine</li>
 *   <li>HALF_OPEN - a single probe call is allowed to test recovery</li>
 * </ul>
 */
public enum CircuitBreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
