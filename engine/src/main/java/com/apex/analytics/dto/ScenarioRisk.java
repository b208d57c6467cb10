package com.apex.analytics.dto;

import com.apex.analytics.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScenarioRisk(
        MarketScenario scenario,
        double probability,
        RiskLevel riskLevel,
        double expectedImpact,
        List<String> keyTriggers
) {
    public enum MarketScenario {
        @JsonProperty("bull") BULL,
        @JsonProperty("bear") BEAR,
        @JsonProperty("sideways") SIDEWAYS,
        @JsonProperty("crisis") CRISIS,
        @JsonProperty("recovery") RECOVERY
    }
}
