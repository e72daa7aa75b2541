package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Caller-assigned request priority. Forwarded to engines and used as a metric tag. */
public enum Priority {
    @JsonProperty("high") HIGH,
    @JsonProperty("normal") NORMAL,
    @JsonProperty("low") LOW
}
