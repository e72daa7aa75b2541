package com.phillippitts.sitedetect.exception;

import com.phillippitts.sitedetect.domain.Capability;

/**
 * Thrown when an engine call or probe exceeds its deadline. Treated exactly like any other
 * call failure by circuit breakers and metrics.
 */
public class EngineTimeoutException extends EngineCallException {

    private final long timeoutMs;

    public EngineTimeoutException(Capability capability, String endpoint, long timeoutMs) {
        super("Deadline of " + timeoutMs + " ms exceeded", capability, endpoint);
        this.timeoutMs = timeoutMs;
    }

    public EngineTimeoutException(Capability capability, String endpoint, long timeoutMs, Throwable cause) {
        super("Deadline of " + timeoutMs + " ms exceeded", capability, endpoint, null, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ENGINE_TIMEOUT;
    }
}
