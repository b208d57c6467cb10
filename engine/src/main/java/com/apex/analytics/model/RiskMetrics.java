package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Upstream risk statistics for a single investment. {@code correlations} is keyed by the other investment's id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskMetrics {
    private Double volatility;
    private Double beta;
    @Builder.Default
    private Map<String, Double> correlations = Map.of();
}
