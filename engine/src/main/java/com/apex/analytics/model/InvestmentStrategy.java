package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InvestmentStrategy {
    BUY("buy"),
    HOLD("hold"),
    SELL("sell"),
    SHORT("short"),
    LONG("long"),
    HEDGE("hedge"),
    ARBITRAGE("arbitrage"),
    PAIRS_TRADE("pairs-trade"),
    MOMENTUM("momentum"),
    VALUE("value"),
    GROWTH("growth"),
    INCOME("income"),
    COMPLEX("complex");

    private final String code;

    InvestmentStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static InvestmentStrategy fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (InvestmentStrategy strategy : values()) {
            if (strategy.code.equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }
}
