package com.apex.analytics.dto;

import java.util.Map;

/**
 * Summary of a simulated return distribution. {@code percentiles} is keyed by the percentile
 * as a string ("1", "5", ... "99"), in ascending order.
 *
 * @param expectedShortfall mean of all samples at or below the 5th percentile
 */
public record MonteCarloResults(
        int iterations,
        double meanReturn,
        double standardDeviation,
        Map<String, Double> percentiles,
        double probabilityOfLoss,
        double probabilityOfTarget,
        double expectedShortfall
) {
    public double percentile(int percentile) {
        Double value = percentiles.get(String.valueOf(percentile));
        if (value == null) {
            throw new IllegalArgumentException("Percentile not reported: " + percentile);
        }
        return value;
    }
}
