package com.phillippitts.sitedetect.exception;

import com.phillippitts.sitedetect.domain.Capability;

/**
 * Thrown when an inference engine call fails: transport error, non-success response,
 * or malformed payload.
 */
public class EngineCallException extends SiteDetectException {

    private final Capability capability;
    private final String endpoint;
    private final Integer httpStatus;

    public EngineCallException(String message, Capability capability, String endpoint) {
        this(message, capability, endpoint, null, null);
    }

    public EngineCallException(String message, Capability capability, String endpoint,
                               Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.capability = capability;
        this.endpoint = endpoint;
        this.httpStatus = httpStatus;
    }

    public Capability getCapability() {
        return capability;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** HTTP status returned by the engine, or null when no response was received. */
    public Integer getHttpStatus() {
        return httpStatus;
    }

    /** Kind used when this failure is surfaced in a result. */
    public ErrorKind kind() {
        return ErrorKind.ENGINE_CALL_ERROR;
    }
}
