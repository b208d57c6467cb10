package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intended holding horizon of an investment idea.
 */
public enum TimeHorizon {
    INTRADAY("intraday"),
    SHORT("short"),
    MEDIUM("medium"),
    LONG("long"),
    VERY_LONG("very-long");

    private final String code;

    TimeHorizon(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TimeHorizon fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (TimeHorizon horizon : values()) {
            if (horizon.code.equalsIgnoreCase(value.trim())) {
                return horizon;
            }
        }
        throw new IllegalArgumentException("Unknown time horizon: " + value);
    }
}
