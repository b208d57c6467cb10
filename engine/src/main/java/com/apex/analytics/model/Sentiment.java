package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Sentiment {
    VERY_POSITIVE("very-positive"),
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative"),
    VERY_NEGATIVE("very-negative");

    private final String code;

    Sentiment(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Sentiment fromCode(String value) {
        if (value == null || value.isBlank()) {
            return NEUTRAL;
        }
        for (Sentiment sentiment : values()) {
            if (sentiment.code.equalsIgnoreCase(value.trim())) {
                return sentiment;
            }
        }
        return NEUTRAL;
    }
}
