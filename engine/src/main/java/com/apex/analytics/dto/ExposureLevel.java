package com.apex.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Three-step level used by the liquidity, concentration, correlation and operational sub-assessments.
 */
public enum ExposureLevel {
    @JsonProperty("low") LOW,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high") HIGH
}
