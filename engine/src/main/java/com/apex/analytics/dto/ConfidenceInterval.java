package com.apex.analytics.dto;

public record ConfidenceInterval(
        double level,
        double lowerBound,
        double upperBound,
        double standardError
) {}
