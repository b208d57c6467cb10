package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentTrend {
    IMPROVING("improving"),
    STABLE("stable"),
    DETERIORATING("deteriorating");

    private final String code;

    SentimentTrend(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static SentimentTrend fromCode(String value) {
        if (value == null || value.isBlank()) {
            return STABLE;
        }
        for (SentimentTrend trend : values()) {
            if (trend.code.equalsIgnoreCase(value.trim())) {
                return trend;
            }
        }
        return STABLE;
    }
}
