package com.apex.analytics.service;

import com.apex.analytics.config.AnalyticsProperties;
import com.apex.analytics.dto.KeyMetrics;
import com.apex.analytics.model.Fundamentals;
import com.apex.analytics.model.Investment;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.InvestmentStrategy;
import com.apex.analytics.model.PriceBar;
import com.apex.analytics.model.RiskLevel;
import com.apex.analytics.model.SentimentAnalysis;
import com.apex.analytics.model.TechnicalIndicators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.apex.analytics.service.PortfolioStatistics.clamp;
import static com.apex.analytics.service.PortfolioStatistics.finiteOrZero;

/**
 * Financial, construction, quality and risk-adjusted metrics for an investment idea.
 * Total over its input: missing data falls back to neutral values and no figure is NaN.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyMetricsService {

    private static final double NEUTRAL_SCORE = 50.0;
    private static final double DEFAULT_Z_SCORE = -1.645;
    private static final Map<Double, Double> Z_SCORES = Map.of(
            0.01, -2.326,
            0.05, -1.645,
            0.10, -1.282
    );

    private final AnalyticsProperties properties;
    private final PortfolioStatistics statistics;
    private final DataQualityService dataQualityService;

    public KeyMetrics calculateKeyMetrics(InvestmentIdea idea) {
        AnalyticsProperties.Assumptions assumptions = properties.getAssumptions();
        List<Investment> investments = statistics.investments(idea);

        double expectedReturn = statistics.expectedReturn(idea);
        double historicalReturn = statistics.historicalExpectedReturn(investments);
        double volatility = statistics.averageVolatility(investments);
        double maxDrawdown = calculateMaxDrawdown(investments);

        KeyMetrics metrics = KeyMetrics.builder()
                .expectedReturn(expectedReturn)
                .volatility(volatility)
                .sharpeRatio(ratio(expectedReturn - assumptions.getRiskFreeRate(), volatility))
                .maxDrawdown(maxDrawdown)
                .valueAtRisk(finiteOrZero(historicalReturn + getZScore(assumptions.getVarConfidenceLevel()) * volatility))
                .diversificationRatio(calculateDiversificationRatio(investments))
                .correlationScore(calculateCorrelationScore(investments))
                .concentrationRisk(statistics.herfindahlIndex(investments))
                .fundamentalScore(calculateFundamentalScore(investments))
                .technicalScore(calculateTechnicalScore(investments))
                .sentimentScore(calculateSentimentScore(investments))
                .informationRatio(ratio(historicalReturn - assumptions.getBenchmarkReturn(),
                        volatility * assumptions.getTrackingErrorFactor()))
                .calmarRatio(ratio(expectedReturn, maxDrawdown))
                .sortinoRatio(ratio(historicalReturn, volatility * assumptions.getDownsideDeviationFactor()))
                .timeToBreakeven(calculateTimeToBreakeven(expectedReturn))
                .optimalHoldingPeriod(statistics.holdingPeriodDays(idea != null ? idea.getTimeHorizon() : null))
                .dataQuality(dataQualityService.assess(idea != null ? idea.getSupportingData() : null))
                .modelConfidence(idea != null ? finiteOrZero(idea.getConfidenceScore()) : 0.0)
                .marketConditionSuitability(calculateMarketConditionSuitability(idea))
                .build();

        log.debug("Key metrics for idea {}: expectedReturn={}, volatility={}, sharpe={}, maxDrawdown={}",
                idea != null ? idea.getId() : null, expectedReturn, volatility, metrics.getSharpeRatio(), maxDrawdown);
        return metrics;
    }

    /**
     * One-tailed standard normal quantile for the supported confidence levels; -1.645 otherwise.
     */
    public double getZScore(double confidenceLevel) {
        return Z_SCORES.getOrDefault(confidenceLevel, DEFAULT_Z_SCORE);
    }

    double calculateMaxDrawdown(List<Investment> investments) {
        double maxDrawdown = 0.0;
        for (Investment investment : investments) {
            List<PriceBar> bars = statistics.bars(investment);
            if (bars.size() < 2) {
                continue;
            }
            double peak = bars.get(0).getAdjustedClose();
            for (int i = 1; i < bars.size(); i++) {
                double price = bars.get(i).getAdjustedClose();
                if (price > peak) {
                    peak = price;
                } else if (peak > 0) {
                    double drawdown = (peak - price) / peak;
                    if (drawdown > maxDrawdown) maxDrawdown = drawdown;
                }
            }
        }
        return finiteOrZero(maxDrawdown);
    }

    double calculateDiversificationRatio(List<Investment> investments) {
        int n = investments.size();
        if (n <= 1) {
            return 0.0;
        }
        double sectorDiversity = (double) statistics.distinctSectors(investments).size() / n;
        double typeDiversity = (double) statistics.distinctAssetTypes(investments) / n;
        return (sectorDiversity + typeDiversity) / 2;
    }

    double calculateCorrelationScore(List<Investment> investments) {
        if (investments.size() <= 1) {
            return 0.0;
        }
        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < investments.size(); i++) {
            for (int j = i + 1; j < investments.size(); j++) {
                total += Math.abs(statistics.correlation(investments.get(i), investments.get(j)));
                pairs++;
            }
        }
        return total / pairs;
    }

    double calculateFundamentalScore(List<Investment> investments) {
        double total = 0.0;
        int scored = 0;
        for (Investment investment : investments) {
            Fundamentals fundamentals = investment.getFundamentals();
            if (fundamentals == null) {
                continue;
            }
            double score = NEUTRAL_SCORE;

            Double pe = fundamentals.getPeRatio();
            if (pe != null && pe > 0) {
                if (pe < 15) score += 10;
                else if (pe < 25) score += 5;
                else if (pe > 40) score -= 10;
            }

            Double margin = fundamentals.getProfitMargin();
            if (margin != null && margin > 0) {
                if (margin > 0.15) score += 10;
                else if (margin > 0.10) score += 5;
            }

            Double roe = fundamentals.getReturnOnEquity();
            if (roe != null && roe > 0) {
                if (roe > 0.15) score += 10;
                else if (roe > 0.10) score += 5;
            }

            Double debtToEquity = fundamentals.getDebtToEquity();
            if (debtToEquity != null) {
                if (debtToEquity < 0.3) score += 5;
                else if (debtToEquity > 1.0) score -= 10;
            }

            total += clamp(score, 0, 100);
            scored++;
        }
        return scored > 0 ? total / scored : NEUTRAL_SCORE;
    }

    double calculateTechnicalScore(List<Investment> investments) {
        double total = 0.0;
        int scored = 0;
        for (Investment investment : investments) {
            TechnicalIndicators technical = investment.getTechnicalIndicators();
            if (technical == null) {
                continue;
            }
            double score = NEUTRAL_SCORE;

            Double rsi = technical.getRelativeStrengthIndex();
            if (isPresent(rsi)) {
                if (rsi > 30 && rsi < 70) score += 10;
                else if (rsi < 30) score += 15;
                else if (rsi > 70) score -= 10;
            }

            double price = investment.getCurrentPrice();
            Double ma50 = technical.getMa50();
            Double ma200 = technical.getMa200();
            if (price != 0 && ma50 != null && ma200 != null) {
                if (price > ma50 && ma50 > ma200) score += 15;
                else if (price < ma50 && ma50 < ma200) score -= 10;
            }

            if (isPresent(technical.getMacdLine()) && isPresent(technical.getMacdSignal())) {
                score += technical.getMacdLine() > technical.getMacdSignal() ? 5 : -5;
            }

            total += clamp(score, 0, 100);
            scored++;
        }
        return scored > 0 ? total / scored : NEUTRAL_SCORE;
    }

    double calculateSentimentScore(List<Investment> investments) {
        double total = 0.0;
        int scored = 0;
        for (Investment investment : investments) {
            SentimentAnalysis sentiment = investment.getSentimentAnalysis();
            if (sentiment == null) {
                continue;
            }
            double score = NEUTRAL_SCORE;

            if (sentiment.getOverallSentiment() != null) {
                score += switch (sentiment.getOverallSentiment()) {
                    case VERY_POSITIVE -> 20;
                    case POSITIVE -> 10;
                    case NEUTRAL -> 0;
                    case NEGATIVE -> -10;
                    case VERY_NEGATIVE -> -20;
                };
            }
            if (sentiment.getSentimentTrend() != null) {
                score += switch (sentiment.getSentimentTrend()) {
                    case IMPROVING -> 10;
                    case STABLE -> 0;
                    case DETERIORATING -> -10;
                };
            }

            SentimentAnalysis.AnalystRecommendations analysts = sentiment.getAnalystRecommendations();
            if (analysts != null && analysts.total() > 0) {
                double buyRatio = (double) analysts.getBuy() / analysts.total();
                score += (buyRatio - 0.5) * 20;
            }

            total += clamp(score, 0, 100);
            scored++;
        }
        return scored > 0 ? total / scored : NEUTRAL_SCORE;
    }

    double calculateTimeToBreakeven(double expectedReturn) {
        if (expectedReturn <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return finiteOrZero(properties.getAssumptions().getTransactionCost() / expectedReturn * 365);
    }

    double calculateMarketConditionSuitability(InvestmentIdea idea) {
        double score = NEUTRAL_SCORE;
        if (idea == null) {
            return score;
        }
        InvestmentStrategy strategy = idea.getStrategy();
        if (strategy == InvestmentStrategy.GROWTH) score += 10;
        else if (strategy == InvestmentStrategy.VALUE) score += 5;
        else if (strategy == InvestmentStrategy.MOMENTUM) score -= 5;

        RiskLevel riskLevel = idea.getRiskLevel();
        if (riskLevel != null && riskLevel.isElevated()) {
            score -= 10;
        }
        return clamp(score, 0, 100);
    }

    private static boolean isPresent(Double value) {
        return value != null && value != 0;
    }

    private static double ratio(double numerator, double denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return finiteOrZero(numerator / denominator);
    }
}
