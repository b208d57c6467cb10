package com.apex.analytics.service;

import com.apex.analytics.config.AnalyticsProperties;
import com.apex.analytics.model.Investment;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.Outcome;
import com.apex.analytics.model.PriceBar;
import com.apex.analytics.model.RiskMetrics;
import com.apex.analytics.model.TimeHorizon;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Low-level, equal-weighted portfolio statistics shared by the metrics, risk and outcome services.
 * Every method is total: empty portfolios and missing optional data resolve to documented defaults.
 */
@Component
@RequiredArgsConstructor
public class PortfolioStatistics {

    static final int DEFAULT_HOLDING_PERIOD_DAYS = 365;
    static final double DEFAULT_BETA = 1.0;

    private final AnalyticsProperties properties;

    public List<Investment> investments(InvestmentIdea idea) {
        if (idea == null || idea.getInvestments() == null) {
            return List.of();
        }
        return idea.getInvestments().stream().filter(Objects::nonNull).toList();
    }

    public List<Outcome> outcomes(InvestmentIdea idea) {
        if (idea == null || idea.getPotentialOutcomes() == null) {
            return List.of();
        }
        return idea.getPotentialOutcomes().stream().filter(Objects::nonNull).toList();
    }

    /**
     * Probability-weighted outcome return, or the historical fallback when the idea carries no outcomes.
     */
    public double expectedReturn(InvestmentIdea idea) {
        List<Outcome> outcomes = outcomes(idea);
        if (outcomes.isEmpty()) {
            return historicalExpectedReturn(investments(idea));
        }
        double weighted = 0.0;
        for (Outcome outcome : outcomes) {
            weighted += outcome.getReturnEstimate() * outcome.getProbability();
        }
        return finiteOrZero(weighted);
    }

    /**
     * Portfolio-average annualized return from price history alone.
     */
    public double historicalExpectedReturn(List<Investment> investments) {
        if (investments.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Investment investment : investments) {
            total += annualizedReturn(investment);
        }
        return total / investments.size();
    }

    public double annualizedReturn(Investment investment) {
        List<PriceBar> bars = bars(investment);
        if (bars.size() < 2) {
            return 0.0;
        }
        double first = bars.get(0).getAdjustedClose();
        double last = bars.get(bars.size() - 1).getAdjustedClose();
        if (first <= 0) {
            return 0.0;
        }
        int periods = bars.size();
        double annualized = Math.pow(last / first, (double) properties.getAssumptions().getTradingDaysPerYear() / periods) - 1;
        return finiteOrZero(annualized);
    }

    public double averageVolatility(List<Investment> investments) {
        if (investments.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Investment investment : investments) {
            RiskMetrics metrics = investment.getRiskMetrics();
            if (metrics != null && metrics.getVolatility() != null) {
                total += metrics.getVolatility();
            }
        }
        return finiteOrZero(total / investments.size());
    }

    public double averageBeta(List<Investment> investments) {
        if (investments.isEmpty()) {
            return DEFAULT_BETA;
        }
        double total = 0.0;
        for (Investment investment : investments) {
            RiskMetrics metrics = investment.getRiskMetrics();
            total += metrics != null && metrics.getBeta() != null ? metrics.getBeta() : DEFAULT_BETA;
        }
        return finiteOrZero(total / investments.size());
    }

    /**
     * Herfindahl-Hirschman index under equal weights, i.e. 1/n. An empty portfolio is fully concentrated.
     */
    public double herfindahlIndex(List<Investment> investments) {
        if (investments.isEmpty()) {
            return 1.0;
        }
        double weight = 1.0 / investments.size();
        double hhi = 0.0;
        for (int i = 0; i < investments.size(); i++) {
            hhi += weight * weight;
        }
        return hhi;
    }

    /**
     * Correlation of {@code first} to {@code second} as recorded on the first investment's risk metrics.
     */
    public double correlation(Investment first, Investment second) {
        RiskMetrics metrics = first.getRiskMetrics();
        if (metrics != null) {
            Map<String, Double> correlations = metrics.getCorrelations();
            if (correlations != null && second.getId() != null) {
                Double value = correlations.get(second.getId());
                if (value != null && Double.isFinite(value)) {
                    return value;
                }
            }
        }
        return properties.getAssumptions().getDefaultCorrelation();
    }

    /**
     * Distinct non-blank sectors in first-seen order.
     */
    public Set<String> distinctSectors(List<Investment> investments) {
        Set<String> sectors = new LinkedHashSet<>();
        for (Investment investment : investments) {
            if (investment.hasSector()) {
                sectors.add(investment.getSector());
            }
        }
        return sectors;
    }

    public int distinctAssetTypes(List<Investment> investments) {
        return (int) investments.stream().map(Investment::getType).distinct().count();
    }

    /**
     * Volume over the trailing window divided by the full window length, so short histories read as thin.
     */
    public double trailingAverageVolume(Investment investment) {
        List<PriceBar> bars = bars(investment);
        int window = properties.getLiquidity().getVolumeWindow();
        int start = Math.max(0, bars.size() - window);
        long sum = 0L;
        for (int i = start; i < bars.size(); i++) {
            sum += bars.get(i).getVolume();
        }
        return ((double) sum) / window;
    }

    public boolean hasLowVolumeBar(Investment investment) {
        long minVolume = properties.getLiquidity().getMinDailyVolume();
        return bars(investment).stream().anyMatch(bar -> bar.getVolume() < minVolume);
    }

    public int holdingPeriodDays(TimeHorizon horizon) {
        if (horizon == null) {
            return DEFAULT_HOLDING_PERIOD_DAYS;
        }
        return switch (horizon) {
            case INTRADAY -> 1;
            case SHORT -> 90;
            case MEDIUM -> 365;
            case LONG -> 1095;
            case VERY_LONG -> 1825;
        };
    }

    public List<PriceBar> bars(Investment investment) {
        if (investment.getHistoricalPerformance() == null) {
            return List.of();
        }
        return investment.getHistoricalPerformance().stream().filter(Objects::nonNull).toList();
    }

    static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
