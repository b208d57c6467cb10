package com.apex.analytics.service;

import com.apex.analytics.config.AnalyticsProperties;
import com.apex.analytics.dto.ConcentrationRisk;
import com.apex.analytics.dto.CorrelationRisk;
import com.apex.analytics.dto.CreditRisk;
import com.apex.analytics.dto.ExposureLevel;
import com.apex.analytics.dto.LiquidityRisk;
import com.apex.analytics.dto.MarketRisk;
import com.apex.analytics.dto.OperationalRisk;
import com.apex.analytics.dto.RiskAssessment;
import com.apex.analytics.dto.RiskFactor;
import com.apex.analytics.dto.RiskMitigation;
import com.apex.analytics.dto.ScenarioRisk;
import com.apex.analytics.dto.StressTestResult;
import com.apex.analytics.model.AssetType;
import com.apex.analytics.model.Investment;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.InvestmentStrategy;
import com.apex.analytics.model.RiskLevel;
import com.apex.analytics.model.TimeHorizon;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Multi-factor risk assessment: overall score and level, risk factors with mitigations,
 * stress tests, market scenarios and the liquidity, concentration, market, credit and
 * operational sub-assessments.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAssessmentService {

    private static final double HIGH_BETA_THRESHOLD = 1.2;
    private static final double CORRELATION_ALERT = 0.7;
    private static final double CORRELATION_HIGH = 0.8;

    private final AnalyticsProperties properties;
    private final PortfolioStatistics statistics;
    private final DataQualityService dataQualityService;

    public RiskAssessment assessRisk(InvestmentIdea idea) {
        List<Investment> investments = statistics.investments(idea);

        double riskScore = calculateRiskScore(investments, idea);
        RiskLevel level = RiskLevel.fromScore(riskScore);
        List<RiskFactor> riskFactors = identifyRiskFactors(investments, idea);

        RiskAssessment assessment = RiskAssessment.builder()
                .overallRiskLevel(level)
                .riskScore(riskScore)
                .riskFactors(riskFactors)
                .riskMitigation(riskFactors.stream().map(this::mitigationFor).toList())
                .stressTestResults(performStressTests(investments))
                .scenarioAnalysis(scenarioAnalysis())
                .correlationRisks(assessCorrelationRisks(investments))
                .liquidityRisk(assessLiquidityRisk(investments))
                .concentrationRisk(assessConcentrationRisk(investments))
                .marketRisk(assessMarketRisk(investments))
                .creditRisk(assessCreditRisk(investments))
                .operationalRisk(assessOperationalRisk(idea))
                .build();

        log.debug("Risk assessment for idea {}: score={}, level={}, factors={}",
                idea != null ? idea.getId() : null, riskScore, level, riskFactors.size());
        return assessment;
    }

    double calculateRiskScore(List<Investment> investments, InvestmentIdea idea) {
        double volatilityRisk = Math.min(statistics.averageVolatility(investments) * 100, 40);
        double concentrationRisk = statistics.herfindahlIndex(investments) * 20;
        double horizonRisk = timeHorizonRisk(idea != null ? idea.getTimeHorizon() : null);
        double strategyRisk = strategyRisk(idea != null ? idea.getStrategy() : null);
        return (volatilityRisk + concentrationRisk + horizonRisk + strategyRisk) / 4;
    }

    double timeHorizonRisk(TimeHorizon horizon) {
        if (horizon == null) {
            return 15;
        }
        return switch (horizon) {
            case INTRADAY -> 30;
            case SHORT -> 20;
            case MEDIUM -> 10;
            case LONG -> 5;
            case VERY_LONG -> 2;
        };
    }

    double strategyRisk(InvestmentStrategy strategy) {
        if (strategy == null) {
            return 15;
        }
        return switch (strategy) {
            case BUY, LONG -> 10;
            case HOLD, INCOME -> 5;
            case SELL, PAIRS_TRADE -> 15;
            case SHORT, COMPLEX -> 25;
            case HEDGE, VALUE -> 8;
            case ARBITRAGE, GROWTH -> 12;
            case MOMENTUM -> 20;
        };
    }

    List<RiskFactor> identifyRiskFactors(List<Investment> investments, InvestmentIdea idea) {
        List<RiskFactor> factors = new ArrayList<>();
        if (investments.isEmpty()) {
            factors.add(new RiskFactor(RiskFactor.Type.OPERATIONAL, RiskFactor.Severity.HIGH, 1.0, 100,
                    "No investments in portfolio", RiskFactor.Timeframe.IMMEDIATE));
            return factors;
        }

        double avgBeta = statistics.averageBeta(investments);
        if (avgBeta > HIGH_BETA_THRESHOLD) {
            factors.add(new RiskFactor(RiskFactor.Type.MARKET, RiskFactor.Severity.MEDIUM, 0.3, (avgBeta - 1) * 20,
                    String.format(Locale.ROOT, "High market sensitivity (Beta: %.2f)", avgBeta),
                    RiskFactor.Timeframe.SHORT_TERM));
        }

        long illiquid = investments.stream().filter(statistics::hasLowVolumeBar).count();
        if (illiquid > 0) {
            factors.add(new RiskFactor(RiskFactor.Type.LIQUIDITY, RiskFactor.Severity.MEDIUM, 0.4, 15,
                    illiquid + " assets with potential liquidity constraints", RiskFactor.Timeframe.IMMEDIATE));
        }

        if (statistics.distinctSectors(investments).size() <= 2 && investments.size() > 2) {
            factors.add(new RiskFactor(RiskFactor.Type.MARKET, RiskFactor.Severity.HIGH, 0.5, 25,
                    "High sector concentration risk", RiskFactor.Timeframe.MEDIUM_TERM));
        }

        if (idea != null && idea.getStrategy() == InvestmentStrategy.MOMENTUM) {
            factors.add(new RiskFactor(RiskFactor.Type.MARKET, RiskFactor.Severity.MEDIUM, 0.6, 20,
                    "Momentum strategy vulnerable to trend reversals", RiskFactor.Timeframe.SHORT_TERM));
        }

        // Keep at least one factor so a mitigation is always offered
        if (factors.isEmpty()) {
            factors.add(new RiskFactor(RiskFactor.Type.MARKET, RiskFactor.Severity.LOW, 0.2, 5,
                    "General market risk exposure", RiskFactor.Timeframe.MEDIUM_TERM));
        }
        return factors;
    }

    RiskMitigation mitigationFor(RiskFactor factor) {
        return switch (factor.type()) {
            case MARKET -> new RiskMitigation(factor.type(),
                    "Consider hedging with market-neutral positions or defensive assets",
                    0.7, 0.02, RiskMitigation.Implementation.GRADUAL);
            case LIQUIDITY -> new RiskMitigation(factor.type(),
                    "Maintain cash reserves and stagger position sizes",
                    0.8, 0.01, RiskMitigation.Implementation.IMMEDIATE);
            case CREDIT -> new RiskMitigation(factor.type(),
                    "Diversify across credit ratings and monitor credit spreads",
                    0.6, 0.015, RiskMitigation.Implementation.GRADUAL);
            default -> new RiskMitigation(factor.type(),
                    "Monitor closely and maintain stop-loss levels",
                    0.5, 0.005, RiskMitigation.Implementation.IMMEDIATE);
        };
    }

    List<StressTestResult> performStressTests(List<Investment> investments) {
        List<StressTestResult> results = new ArrayList<>();
        results.add(new StressTestResult("Market Crash (-30%)", 0.05, 0.25, 365,
                "Broad market decline of 30% over 3 months"));
        results.add(new StressTestResult("Interest Rate Shock (+200bp)", 0.15, 0.12, 180,
                "Rapid increase in interest rates by 2 percentage points"));
        for (String sector : statistics.distinctSectors(investments)) {
            results.add(new StressTestResult(sector + " Sector Decline (-20%)", 0.1, 0.15, 270,
                    "Sector-specific decline in " + sector));
        }
        return results;
    }

    List<ScenarioRisk> scenarioAnalysis() {
        return List.of(
                new ScenarioRisk(ScenarioRisk.MarketScenario.BULL, 0.3, RiskLevel.LOW, 0.15,
                        List.of("Economic growth", "Low interest rates", "Positive earnings")),
                new ScenarioRisk(ScenarioRisk.MarketScenario.BEAR, 0.2, RiskLevel.HIGH, -0.25,
                        List.of("Recession", "High inflation", "Geopolitical tensions")),
                new ScenarioRisk(ScenarioRisk.MarketScenario.SIDEWAYS, 0.4, RiskLevel.MODERATE, 0.02,
                        List.of("Mixed economic signals", "Uncertainty", "Range-bound markets")),
                new ScenarioRisk(ScenarioRisk.MarketScenario.CRISIS, 0.05, RiskLevel.VERY_HIGH, -0.40,
                        List.of("Financial crisis", "Black swan event", "System failure")),
                new ScenarioRisk(ScenarioRisk.MarketScenario.RECOVERY, 0.05, RiskLevel.MODERATE, 0.25,
                        List.of("Post-crisis recovery", "Policy support", "Pent-up demand"))
        );
    }

    List<CorrelationRisk> assessCorrelationRisks(List<Investment> investments) {
        List<CorrelationRisk> risks = new ArrayList<>();
        for (int i = 0; i < investments.size(); i++) {
            for (int j = i + 1; j < investments.size(); j++) {
                Investment first = investments.get(i);
                Investment second = investments.get(j);
                double correlation = statistics.correlation(first, second);
                if (Math.abs(correlation) > CORRELATION_ALERT) {
                    ExposureLevel level = Math.abs(correlation) > CORRELATION_HIGH ? ExposureLevel.HIGH : ExposureLevel.MEDIUM;
                    risks.add(new CorrelationRisk(first.getName() + " - " + second.getName(), correlation, level,
                            String.format(Locale.ROOT, "High correlation (%.2f) reduces diversification benefits", correlation)));
                }
            }
        }
        return risks;
    }

    LiquidityRisk assessLiquidityRisk(List<Investment> investments) {
        if (investments.isEmpty()) {
            return new LiquidityRisk(ExposureLevel.LOW, 0.0, 0.01, 0.005, 1);
        }
        AnalyticsProperties.Liquidity cfg = properties.getLiquidity();
        double totalVolume = 0.0;
        int lowVolumeCount = 0;
        for (Investment investment : investments) {
            double volume = statistics.trailingAverageVolume(investment);
            totalVolume += volume;
            if (volume < cfg.getMinDailyVolume()) {
                lowVolumeCount++;
            }
        }

        ExposureLevel level;
        if (lowVolumeCount > investments.size() * cfg.getHighRiskFraction()) {
            level = ExposureLevel.HIGH;
        } else if (lowVolumeCount > 0) {
            level = ExposureLevel.MEDIUM;
        } else {
            level = ExposureLevel.LOW;
        }

        return switch (level) {
            case HIGH -> new LiquidityRisk(level, totalVolume / investments.size(), 0.01, 0.02, 5);
            case MEDIUM -> new LiquidityRisk(level, totalVolume / investments.size(), 0.01, 0.01, 2);
            case LOW -> new LiquidityRisk(level, totalVolume / investments.size(), 0.01, 0.005, 1);
        };
    }

    ConcentrationRisk assessConcentrationRisk(List<Investment> investments) {
        int n = investments.size();
        int denominator = Math.max(n, 1);
        double sector = 1 - (double) statistics.distinctSectors(investments).size() / denominator;
        double assetClass = 1 - (double) statistics.distinctAssetTypes(investments) / denominator;
        double singlePosition = n == 0 ? 1.0 : 1.0 / n;

        ExposureLevel level;
        if (sector > 0.7 || assetClass > 0.7 || singlePosition > 0.3) {
            level = ExposureLevel.HIGH;
        } else if (sector > 0.5 || assetClass > 0.5 || singlePosition > 0.2) {
            level = ExposureLevel.MEDIUM;
        } else {
            level = ExposureLevel.LOW;
        }
        return new ConcentrationRisk(level, sector, 0.5, assetClass, singlePosition);
    }

    MarketRisk assessMarketRisk(List<Investment> investments) {
        double beta = statistics.averageBeta(investments);
        return new MarketRisk(beta, beta, 0.7, 0.3, 0.1);
    }

    CreditRisk assessCreditRisk(List<Investment> investments) {
        boolean holdsBonds = investments.stream().anyMatch(investment -> investment.getType() == AssetType.BOND);
        if (!holdsBonds) {
            return null;
        }
        return new CreditRisk("BBB", 0.02, 0.6, 0.015);
    }

    OperationalRisk assessOperationalRisk(InvestmentIdea idea) {
        double complexity = idea != null && idea.getStrategy() == InvestmentStrategy.COMPLEX ? 0.8 : 0.3;
        double dataQuality = dataQualityService.assess(idea != null ? idea.getSupportingData() : null) / 100;

        ExposureLevel level;
        if (complexity > 0.6) {
            level = ExposureLevel.HIGH;
        } else if (complexity > 0.3 || dataQuality < 0.5) {
            level = ExposureLevel.MEDIUM;
        } else {
            level = ExposureLevel.LOW;
        }
        return new OperationalRisk(level, 0.2, 0.1, complexity, 0.15, dataQuality);
    }
}
