package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Five-step risk scale shared by ideas (declared risk) and assessments (computed risk).
 */
public enum RiskLevel {
    VERY_LOW("very-low"),
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    VERY_HIGH("very-high");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Buckets a 0-100 risk score. Each cutoff is inclusive on the lower bucket.
     */
    public static RiskLevel fromScore(double score) {
        if (score <= 20) return VERY_LOW;
        if (score <= 40) return LOW;
        if (score <= 60) return MODERATE;
        if (score <= 80) return HIGH;
        return VERY_HIGH;
    }

    public boolean isElevated() {
        return this == HIGH || this == VERY_HIGH;
    }

    @JsonCreator
    public static RiskLevel fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (RiskLevel level : values()) {
            if (level.code.equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}
