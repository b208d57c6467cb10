package com.apex.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param effectiveness expected risk reduction in [0, 1]
 * @param cost          cost as a fraction of the position
 */
public record RiskMitigation(
        RiskFactor.Type riskType,
        String strategy,
        double effectiveness,
        double cost,
        Implementation implementation
) {
    public enum Implementation {
        @JsonProperty("immediate") IMMEDIATE,
        @JsonProperty("gradual") GRADUAL,
        @JsonProperty("conditional") CONDITIONAL
    }
}
