package com.taskrunner.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** VM size requested for a node. */
public enum NodeSize {
    SMALL,
    MEDIUM,
    LARGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeSize fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
