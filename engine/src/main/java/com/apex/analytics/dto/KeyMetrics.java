package com.apex.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyMetrics {
    // Financial
    private double expectedReturn;
    private double volatility;
    private double sharpeRatio;
    private double maxDrawdown;
    private double valueAtRisk;

    // Portfolio construction
    private double diversificationRatio;
    private double correlationScore;
    private double concentrationRisk;

    // Quality, 0-100
    private double fundamentalScore;
    private double technicalScore;
    private double sentimentScore;

    // Risk-adjusted
    private double informationRatio;
    private double calmarRatio;
    private double sortinoRatio;

    // Days. timeToBreakeven is +Infinity when the expected return is not positive.
    private double timeToBreakeven;
    private int optimalHoldingPeriod;

    // Confidence
    private double dataQuality;
    private double modelConfidence;
    private double marketConditionSuitability;
}
