package com.apex.analytics.dto;

import java.time.LocalDate;

public record TimeSeriesProjection(
        LocalDate date,
        double expectedValue,
        ConfidenceBands confidenceBands,
        double cumulativeReturn
) {
    public record ConfidenceBands(double upper95, double upper68, double lower68, double lower95) {}
}
