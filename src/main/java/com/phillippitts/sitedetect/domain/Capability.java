package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Closed set of detection capabilities the orchestrator can route.
 *
 * <p>The lowercase wire name is used on the HTTP surface, in engine payloads, and in metric tags.
 */
public enum Capability {

    @JsonProperty("damage")
    DAMAGE("damage"),

    @JsonProperty("material")
    MATERIAL("material"),

    @JsonProperty("volume")
    VOLUME("volume");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup by wire name.
     */
    public static Optional<Capability> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        for (Capability c : values()) {
            if (c.wireName.equalsIgnoreCase(v)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
