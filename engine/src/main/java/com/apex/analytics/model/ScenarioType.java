package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag on an analyst-supplied outcome estimate.
 */
public enum ScenarioType {
    EXPECTED("expected"),
    BEST("best"),
    WORST("worst");

    private final String code;

    ScenarioType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ScenarioType fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ScenarioType type : values()) {
            if (type.code.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scenario: " + value);
    }
}
