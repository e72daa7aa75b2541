package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Terminal, aggregated answer to a {@link DetectionRequest}.
 *
 * <p>Returned to the caller and retained in request history for status polling.
 *
 * @param requestId generated id used for status lookup
 * @param detectionId generated id of this detection
 * @param photoId photo the request was about
 * @param status aggregate status derived from {@code results}
 * @param results one result per requested capability
 * @param totalProcessingTimeMs wall-clock time from intake to assembly
 * @param modelVersions model version that answered each capability
 * @param correlationId caller-supplied or generated correlation id
 * @param timestamp assembly time
 * @param error summary error when the whole request failed, else null
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DetectionResponse(
        UUID requestId,
        UUID detectionId,
        UUID photoId,
        DetectionStatus status,
        Map<Capability, EngineResult> results,
        long totalProcessingTimeMs,
        Map<Capability, String> modelVersions,
        String correlationId,
        Instant timestamp,
        String error
) {

    public DetectionResponse {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(detectionId, "detectionId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        results = immutableEnumMap(results);
        modelVersions = immutableEnumMap(modelVersions);
    }

    private static <V> Map<Capability, V> immutableEnumMap(Map<Capability, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
