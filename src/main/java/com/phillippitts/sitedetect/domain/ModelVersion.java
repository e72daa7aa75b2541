package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * Immutable description of one deployed model version behind an inference endpoint.
 *
 * <p>Identity within the registry is the {@code (name, version)} pair; see {@link #key()}.
 *
 * @param name model family name (e.g., "damage-detector")
 * @param version model version string (e.g., "v1.2.0")
 * @param capability capability this model serves
 * @param endpoint base URL of the inference engine
 * @param confidenceThreshold minimum confidence considered reliable, in [0, 1]
 * @param enabled whether the model participates in routing
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModelVersion(
        String name,
        String version,
        Capability capability,
        String endpoint,
        double confidenceThreshold,
        boolean enabled
) {

    public ModelVersion {
        requireText(name, "name");
        requireText(version, "version");
        Objects.requireNonNull(capability, "capability must not be null");
        requireText(endpoint, "endpoint");
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "confidenceThreshold must be between 0.0 and 1.0, got: " + confidenceThreshold);
        }
    }

    /** Registry identity: {@code name:version}. */
    public String key() {
        return name + ":" + version;
    }

    /** Returns a copy with the enabled flag replaced. */
    public ModelVersion withEnabled(boolean value) {
        return new ModelVersion(name, version, capability, endpoint, confidenceThreshold, value);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
