package com.phillippitts.sitedetect.service.breaker;

import com.phillippitts.sitedetect.domain.CircuitBreakerState;
import com.phillippitts.sitedetect.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Failure-isolation state machine for a single engine endpoint.
 *
 * <p>Transitions:
 * <ul>
 *   <li>CLOSED → OPEN when {@code failureCount >= threshold}</li>
 *   <li>OPEN → HALF_OPEN once {@code openTimeout} has elapsed since {@code openedAt}
 *       (evaluated lazily by {@link #allowRequest()})</li>
 *   <li>HALF_OPEN → CLOSED on the first success; {@code failureCount} resets to 0</li>
 *   <li>HALF_OPEN → OPEN on any failure; {@code openedAt} resets to now</li>
 * </ul>
 *
 * <p>Successes while CLOSED leave {@code failureCount} untouched; only a transition into CLOSED
 * or {@link #reset()} clears it. While HALF_OPEN, a single probe may be in flight; other callers
 * are rejected until that probe reports back.
 *
 * <p>Thread safety: all state is guarded by this instance's monitor, so breakers for different
 * endpoints never contend. The transition listener is invoked under that monitor and must not
 * call back into the breaker.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    /**
     * Receives state changes.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String endpoint, CircuitBreakerState from, CircuitBreakerState to, int failureCount);

        TransitionListener NOOP = (endpoint, from, to, failureCount) -> { };
    }

    /**
     * Immutable view of breaker state.
     */
    public record Snapshot(
            String endpoint,
            CircuitBreakerState state,
            int failureCount,
            Instant openedAt,
            int successCountInHalfOpen,
            boolean probeInFlight
    ) {}

    private final String endpoint;
    private final int threshold;
    private final Duration openTimeout;
    private final Clock clock;
    private final TransitionListener listener;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private int successCountInHalfOpen;
    private boolean probeInFlight;

    public CircuitBreaker(String endpoint, int threshold, Duration openTimeout, Clock clock,
                          TransitionListener listener) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
        this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener == null ? TransitionListener.NOOP : listener;
    }

    /**
     * Decides whether a call may proceed, acquiring the half-open probe slot when applicable.
     *
     * <p>Callers that receive {@code true} must report the outcome via {@link #recordSuccess()}
     * or {@link #recordFailure()}, or {@link #releasePermission()} when the call is never sent;
     * a false answer means fail fast without a remote call.
     *
     * @return true when the call may proceed
     */
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (!openTimeoutElapsed()) {
                    return false;
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
                probeInFlight = true;
                return true;
            case HALF_OPEN:
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
            default:
                return false;
        }
    }

    /**
     * Non-acquiring variant of {@link #allowRequest()}: true when a call would currently be
     * admitted. Used to filter balancing candidates without claiming probe slots.
     */
    public synchronized boolean isCallPermitted() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> openTimeoutElapsed();
            case HALF_OPEN -> !probeInFlight;
        };
    }

    public synchronized void recordSuccess() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            successCountInHalfOpen++;
            probeInFlight = false;
            failureCount = 0;
            openedAt = null;
            transitionTo(CircuitBreakerState.CLOSED);
        }
        // CLOSED: counter untouched. OPEN: late result of a call admitted before opening.
    }

    public synchronized void recordFailure() {
        failureCount++;
        switch (state) {
            case CLOSED:
                if (failureCount >= threshold) {
                    openedAt = clock.instant();
                    transitionTo(CircuitBreakerState.OPEN);
                }
                break;
            case HALF_OPEN:
                probeInFlight = false;
                openedAt = clock.instant();
                transitionTo(CircuitBreakerState.OPEN);
                break;
            case OPEN:
            default:
                break;
        }
    }

    /**
     * Gives back an admission from {@link #allowRequest()} whose call was never sent. Frees the
     * half-open slot without counting a success or a failure.
     */
    public synchronized void releasePermission() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    /** Forces the breaker back to CLOSED with a zero failure count. */
    public synchronized void reset() {
        failureCount = 0;
        openedAt = null;
        probeInFlight = false;
        if (state != CircuitBreakerState.CLOSED) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    /** Current state without evaluating the open timeout. */
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(endpoint, state, failureCount, openedAt, successCountInHalfOpen, probeInFlight);
    }

    public String getEndpoint() {
        return endpoint;
    }

    private boolean openTimeoutElapsed() {
        return openedAt != null && TimeUtils.hasElapsed(clock, openedAt, openTimeout);
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        if (next == CircuitBreakerState.HALF_OPEN) {
            successCountInHalfOpen = 0;
        }
        LOG.debug("Breaker {} {} -> {} (failures={})", endpoint, previous, next, failureCount);
        listener.onTransition(endpoint, previous, next, failureCount);
    }
}
