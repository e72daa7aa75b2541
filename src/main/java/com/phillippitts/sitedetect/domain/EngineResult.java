package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one attempted capability call. Exactly one exists per requested capability.
 *
 * <p>A result with a non-null {@code error} is a failure; its payload is empty and its
 * confidence is zero.
 *
 * @param capability capability this result answers
 * @param modelVersion version string reported by the engine, or the selected version,
 *                     or "unavailable" when no engine was selected
 * @param confidence engine-reported confidence in [0, 1]
 * @param payload opaque structured engine output
 * @param processingTimeMs wall-clock time of the engine call
 * @param belowThreshold true when confidence is under the model's configured threshold
 * @param error failure description, prefixed with the error kind; null on success
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EngineResult(
        Capability capability,
        String modelVersion,
        double confidence,
        Map<String, Object> payload,
        long processingTimeMs,
        boolean belowThreshold,
        String error
) {

    /** Model version reported when selection failed before any engine was chosen. */
    public static final String UNAVAILABLE = "unavailable";

    public EngineResult {
        Objects.requireNonNull(capability, "capability must not be null");
        modelVersion = modelVersion == null ? UNAVAILABLE : modelVersion;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        processingTimeMs = Math.max(0, processingTimeMs);
    }

    public static EngineResult success(Capability capability, String modelVersion, double confidence,
                                       Map<String, Object> payload, long processingTimeMs,
                                       boolean belowThreshold) {
        return new EngineResult(capability, modelVersion, confidence, payload, processingTimeMs,
                belowThreshold, null);
    }

    public static EngineResult failure(Capability capability, String modelVersion,
                                       long processingTimeMs, String error) {
        Objects.requireNonNull(error, "error must not be null");
        return new EngineResult(capability, modelVersion, 0.0, Map.of(), processingTimeMs, false, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
