package com.apex.analytics.service;

import com.apex.analytics.dto.ExpectedOutcomeModel;
import com.apex.analytics.dto.KeyMetrics;
import com.apex.analytics.dto.Recommendation;
import com.apex.analytics.dto.RiskAssessment;
import com.apex.analytics.dto.SupportingAnalysisReport;
import com.apex.analytics.exception.AnalyticsException;
import com.apex.analytics.model.InvestmentIdea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs metrics, risk and outcome analysis for an idea in parallel and condenses them into a
 * report with a recommendation.
 */
@Slf4j
@Service
public class SupportingAnalysisService {

    static final double DEFAULT_VOLATILITY = 0.2;

    private final KeyMetricsService keyMetricsService;
    private final RiskAssessmentService riskAssessmentService;
    private final OutcomeModelingService outcomeModelingService;
    private final Executor analyticsExecutor;
    private final Clock clock;

    public SupportingAnalysisService(KeyMetricsService keyMetricsService,
                                     RiskAssessmentService riskAssessmentService,
                                     OutcomeModelingService outcomeModelingService,
                                     @Qualifier("analyticsExecutor") Executor analyticsExecutor,
                                     Clock clock) {
        this.keyMetricsService = keyMetricsService;
        this.riskAssessmentService = riskAssessmentService;
        this.outcomeModelingService = outcomeModelingService;
        this.analyticsExecutor = analyticsExecutor;
        this.clock = clock;
    }

    public SupportingAnalysisReport analyze(InvestmentIdea idea) {
        if (idea == null) {
            throw new AnalyticsException("Investment idea is required");
        }
        long started = clock.millis();
        log.info("Starting supporting analysis for idea {}", idea.getId());

        CompletableFuture<KeyMetrics> metricsFuture =
                CompletableFuture.supplyAsync(() -> keyMetricsService.calculateKeyMetrics(idea), analyticsExecutor);
        CompletableFuture<RiskAssessment> riskFuture =
                CompletableFuture.supplyAsync(() -> riskAssessmentService.assessRisk(idea), analyticsExecutor);
        CompletableFuture<ExpectedOutcomeModel> outcomeFuture =
                CompletableFuture.supplyAsync(() -> outcomeModelingService.modelExpectedOutcomes(idea), analyticsExecutor);

        KeyMetrics metrics;
        RiskAssessment risk;
        ExpectedOutcomeModel outcomes;
        try {
            CompletableFuture.allOf(metricsFuture, riskFuture, outcomeFuture).get();
            metrics = metricsFuture.get();
            risk = riskFuture.get();
            outcomes = outcomeFuture.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Supporting analysis interrupted for idea {}", idea.getId());
            throw new AnalyticsException("Supporting analysis interrupted for idea " + idea.getId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Supporting analysis failed for idea {}: {}", idea.getId(), cause.getMessage(), cause);
            throw new AnalyticsException("Supporting analysis failed for idea " + idea.getId(), cause);
        }

        double quality = overallQualityScore(metrics);
        double riskAdjustedReturn = riskAdjustedReturn(outcomes.getProbabilityWeightedReturn(), metrics.getVolatility());
        Recommendation recommendation = recommend(quality, riskAdjustedReturn, risk.getRiskScore());

        SupportingAnalysisReport report = SupportingAnalysisReport.builder()
                .ideaId(idea.getId())
                .generatedAt(Instant.now(clock))
                .keyMetrics(metrics)
                .riskAssessment(risk)
                .outcomeModel(outcomes)
                .overallQualityScore(quality)
                .riskAdjustedReturn(riskAdjustedReturn)
                .recommendation(recommendation)
                .keyConsiderations(keyConsiderations(metrics, outcomes))
                .build();

        log.info("Supporting analysis for idea {} finished in {} ms: {} (quality {}, risk score {})",
                idea.getId(), clock.millis() - started, recommendation,
                String.format(Locale.ROOT, "%.1f", quality), String.format(Locale.ROOT, "%.1f", risk.getRiskScore()));
        return report;
    }

    static double overallQualityScore(KeyMetrics metrics) {
        return (metrics.getFundamentalScore() + metrics.getTechnicalScore() + metrics.getSentimentScore()) / 3;
    }

    static double riskAdjustedReturn(double weightedReturn, double volatility) {
        double denominator = volatility != 0 ? volatility : DEFAULT_VOLATILITY;
        return PortfolioStatistics.finiteOrZero(weightedReturn / denominator);
    }

    static Recommendation recommend(double quality, double riskAdjustedReturn, double riskScore) {
        if (quality >= 70 && riskAdjustedReturn >= 0.5 && riskScore <= 60) {
            return Recommendation.STRONG_BUY;
        }
        if (quality >= 60 && riskAdjustedReturn >= 0.3 && riskScore <= 70) {
            return Recommendation.BUY;
        }
        if (quality >= 50 && riskAdjustedReturn >= 0.2) {
            return Recommendation.HOLD;
        }
        return Recommendation.AVOID;
    }

    static List<String> keyConsiderations(KeyMetrics metrics, ExpectedOutcomeModel outcomes) {
        double breakeven = metrics.getTimeToBreakeven();
        String breakevenText = Double.isFinite(breakeven)
                ? "Time to breakeven: " + (long) Math.ceil(breakeven) + " days"
                : "Time to breakeven: not reached";
        return List.of(
                percent("Expected annual return", outcomes.getProbabilityWeightedReturn()),
                percent("Volatility", metrics.getVolatility()),
                percent("Maximum potential loss (5% VaR)", Math.abs(metrics.getValueAtRisk())),
                breakevenText,
                "Recommended holding period: " + (int) Math.ceil(metrics.getOptimalHoldingPeriod() / 365.0) + " years"
        );
    }

    private static String percent(String label, double fraction) {
        return String.format(Locale.ROOT, "%s: %.1f%%", label, fraction * 100);
    }
}
