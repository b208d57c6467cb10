package com.apex.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AssetType {
    STOCK("stock"),
    ETF("etf"),
    MUTUAL_FUND("mutual-fund"),
    BOND("bond"),
    COMMODITY("commodity"),
    CRYPTOCURRENCY("cryptocurrency"),
    REIT("reit"),
    OTHER("other");

    private final String code;

    AssetType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static AssetType fromCode(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        for (AssetType type : values()) {
            if (type.code.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return OTHER;
    }
}
