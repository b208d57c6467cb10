package com.apex.analytics.dto;

public record MarketRisk(
        double beta,
        double marketSensitivity,
        double sectorSensitivity,
        double interestRateSensitivity,
        double currencyExposure
) {}
