package com.apex.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Recommendation {
    @JsonProperty("strong-buy") STRONG_BUY,
    @JsonProperty("buy") BUY,
    @JsonProperty("hold") HOLD,
    @JsonProperty("avoid") AVOID
}
