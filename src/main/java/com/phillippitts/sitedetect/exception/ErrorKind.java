package com.phillippitts.sitedetect.exception;

/**
 * Error kinds surfaced in per-capability results as {@code "<Kind>: <message>"}.
 */
public enum ErrorKind {
    NO_HEALTHY_ENGINE("NoHealthyEngine"),
    ENGINE_CALL_ERROR("EngineCallError"),
    ENGINE_TIMEOUT("EngineTimeout"),
    UNKNOWN_CAPABILITY("UnknownCapability");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Formats a result error string for this kind. */
    public String describe(String message) {
        return label + ": " + message;
    }
}
