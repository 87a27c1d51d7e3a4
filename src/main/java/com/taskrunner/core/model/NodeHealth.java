package com.taskrunner.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Health derived from node heartbeats. */
public enum NodeHealth {
    HEALTHY,
    STALE,
    UNHEALTHY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeHealth fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
