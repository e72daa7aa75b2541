package com.phillippitts.sitedetect.service.metrics;

import java.util.Locale;

/** Outcome of one engine call, as recorded in metrics. */
public enum CallOutcome {
    SUCCESS,
    ERROR,
    TIMEOUT;

    public boolean failed() {
        return this != SUCCESS;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
