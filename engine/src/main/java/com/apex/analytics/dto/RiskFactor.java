package com.apex.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param probability likelihood in [0, 1]
 * @param impact      potential loss in percent
 */
public record RiskFactor(
        Type type,
        Severity severity,
        double probability,
        double impact,
        String description,
        Timeframe timeHorizon
) {
    public enum Type {
        @JsonProperty("market") MARKET,
        @JsonProperty("credit") CREDIT,
        @JsonProperty("liquidity") LIQUIDITY,
        @JsonProperty("operational") OPERATIONAL,
        @JsonProperty("regulatory") REGULATORY,
        @JsonProperty("geopolitical") GEOPOLITICAL,
        @JsonProperty("currency") CURRENCY,
        @JsonProperty("interest-rate") INTEREST_RATE
    }

    public enum Severity {
        @JsonProperty("low") LOW,
        @JsonProperty("medium") MEDIUM,
        @JsonProperty("high") HIGH,
        @JsonProperty("critical") CRITICAL
    }

    public enum Timeframe {
        @JsonProperty("immediate") IMMEDIATE,
        @JsonProperty("short-term") SHORT_TERM,
        @JsonProperty("medium-term") MEDIUM_TERM,
        @JsonProperty("long-term") LONG_TERM
    }
}
