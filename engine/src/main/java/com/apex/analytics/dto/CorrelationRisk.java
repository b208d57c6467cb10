package com.apex.analytics.dto;

public record CorrelationRisk(
        String assetPair,
        double correlation,
        ExposureLevel riskLevel,
        String description
) {}
