package com.apex.analytics.dto;

public record LiquidityRisk(
        ExposureLevel level,
        double averageDailyVolume,
        double bidAskSpread,
        double marketImpactCost,
        int timeToLiquidate
) {}
