package com.apex.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record Milestone(
        LocalDate date,
        String description,
        double probability,
        double impact,
        Type type
) {
    public enum Type {
        @JsonProperty("catalyst") CATALYST,
        @JsonProperty("risk-event") RISK_EVENT,
        @JsonProperty("decision-point") DECISION_POINT,
        @JsonProperty("market-event") MARKET_EVENT
    }
}
