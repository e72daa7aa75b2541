package com.phillippitts.sitedetect.exception;

import com.phillippitts.sitedetect.domain.Capability;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link EngineCallException} with contextual details appended to the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw EngineCallExceptionBuilder.create("Engine returned non-success status")
 *         .capability(Capability.DAMAGE)
 *         .endpoint("http://damage-engine:8001")
 *         .httpStatus(502)
 *         .durationMs(120)
 *         .build();
 * </pre>
 *
 * <p>Resulting message: {@code Engine returned non-success status (httpStatus=502, durationMs=120)}.
 * The endpoint is kept on the exception, not in the message, so messages can be shown to callers.
 */
public final class EngineCallExceptionBuilder {

    private final String message;
    private Capability capability;
    private String endpoint;
    private Integer httpStatus;
    private Long durationMs;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private EngineCallExceptionBuilder(String message) {
        this.message = message;
    }

    public static EngineCallExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new EngineCallExceptionBuilder(message);
    }

    public EngineCallExceptionBuilder capability(Capability capability) {
        this.capability = capability;
        return this;
    }

    public EngineCallExceptionBuilder endpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public EngineCallExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public EngineCallExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public EngineCallExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a detail rendered into the message. Null keys or values are ignored.
     */
    public EngineCallExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public EngineCallException build() {
        return new EngineCallException(detailedMessage(), capability, endpoint, httpStatus, cause);
    }

    private String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> e : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
