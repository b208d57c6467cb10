package com.apex.analytics.service;

import com.apex.analytics.config.AnalyticsProperties;
import com.apex.analytics.dto.ConcentrationRisk;
import com.apex.analytics.dto.CorrelationRisk;
import com.apex.analytics.dto.ExposureLevel;
import com.apex.analytics.dto.LiquidityRisk;
import com.apex.analytics.dto.RiskAssessment;
import com.apex.analytics.dto.RiskFactor;
import com.apex.analytics.dto.RiskMitigation;
import com.apex.analytics.dto.ScenarioRisk;
import com.apex.analytics.dto.StressTestResult;
import com.apex.analytics.model.Investment;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.InvestmentStrategy;
import com.apex.analytics.model.RiskLevel;
import com.apex.analytics.model.RiskMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.apex.analytics.InvestmentFixtures.CLOCK;
import static com.apex.analytics.InvestmentFixtures.bond;
import static com.apex.analytics.InvestmentFixtures.emptyIdea;
import static com.apex.analytics.InvestmentFixtures.flatBars;
import static com.apex.analytics.InvestmentFixtures.ideaOf;
import static com.apex.analytics.InvestmentFixtures.properties;
import static com.apex.analytics.InvestmentFixtures.sampleIdea;
import static com.apex.analytics.InvestmentFixtures.stock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class RiskAssessmentServiceTest {

    private final AnalyticsProperties properties = properties();
    private final RiskAssessmentService service = new RiskAssessmentService(
            properties, new PortfolioStatistics(properties), new DataQualityService(CLOCK));

    @Test
    void emptyPortfolioReportsSingleOperationalFactor() {
        RiskAssessment assessment = service.assessRisk(emptyIdea());

        assertThat(assessment.getRiskScore()).isCloseTo(12.5, offset(1e-9));
        assertThat(assessment.getOverallRiskLevel()).isEqualTo(RiskLevel.VERY_LOW);
        assertThat(assessment.getRiskFactors()).containsExactly(new RiskFactor(RiskFactor.Type.OPERATIONAL,
                RiskFactor.Severity.HIGH, 1.0, 100, "No investments in portfolio", RiskFactor.Timeframe.IMMEDIATE));
        assertThat(assessment.getRiskMitigation()).hasSize(1);
        assertThat(assessment.getRiskMitigation().get(0).implementation()).isEqualTo(RiskMitigation.Implementation.IMMEDIATE);

        LiquidityRisk liquidity = assessment.getLiquidityRisk();
        assertThat(liquidity.level()).isEqualTo(ExposureLevel.LOW);
        assertThat(liquidity.averageDailyVolume()).isZero();

        ConcentrationRisk concentration = assessment.getConcentrationRisk();
        assertThat(concentration.singlePositionRisk()).isEqualTo(1.0);
        assertThat(concentration.level()).isEqualTo(ExposureLevel.HIGH);

        assertThat(assessment.getMarketRisk().beta()).isEqualTo(1.0);
        assertThat(assessment.creditRiskIfPresent()).isEmpty();
        assertThat(assessment.getCorrelationRisks()).isEmpty();
        assertThat(assessment.getStressTestResults()).hasSize(2);
    }

    @Test
    void highBetaWithBondsAddsMarketFactorAndCreditRisk() {
        InvestmentIdea idea = ideaOf(List.of(
                stock("a", "Technology", 0.3, 1.8),
                stock("b", "Industrials", 0.3, 1.8),
                bond("t", 0.05)));
        idea.getInvestments().get(2).getRiskMetrics().setBeta(0.3);

        RiskAssessment assessment = service.assessRisk(idea);

        assertThat(assessment.getRiskFactors()).hasSize(1);
        RiskFactor factor = assessment.getRiskFactors().get(0);
        assertThat(factor.type()).isEqualTo(RiskFactor.Type.MARKET);
        assertThat(factor.severity()).isEqualTo(RiskFactor.Severity.MEDIUM);
        assertThat(factor.impact()).isCloseTo(6.0, offset(1e-9));
        assertThat(factor.description()).isEqualTo("High market sensitivity (Beta: 1.30)");
        assertThat(assessment.getMarketRisk().beta()).isCloseTo(1.3, offset(1e-9));

        assertThat(assessment.creditRiskIfPresent()).hasValueSatisfying(credit -> {
            assertThat(credit.creditRating()).isEqualTo("BBB");
            assertThat(credit.defaultProbability()).isEqualTo(0.02);
            assertThat(credit.recoveryRate()).isEqualTo(0.6);
            assertThat(credit.creditSpread()).isEqualTo(0.015);
        });

        RiskMitigation mitigation = assessment.getRiskMitigation().get(0);
        assertThat(mitigation.effectiveness()).isEqualTo(0.7);
        assertThat(mitigation.cost()).isEqualTo(0.02);
        assertThat(mitigation.implementation()).isEqualTo(RiskMitigation.Implementation.GRADUAL);
    }

    @Test
    void quietPortfolioStillGetsGeneralMarketFactor() {
        RiskAssessment assessment = service.assessRisk(sampleIdea());

        assertThat(assessment.getRiskFactors()).extracting(RiskFactor::description)
                .containsExactly("General market risk exposure");
        assertThat(assessment.getRiskScore()).isCloseTo(13.0, offset(1e-9));
        assertThat(assessment.getOverallRiskLevel()).isEqualTo(RiskLevel.VERY_LOW);
    }

    @Test
    void concentratedMomentumBasketFiresFactorsInOrder() {
        InvestmentIdea idea = ideaOf(List.of(
                stock("a", "Technology", 0.3, 1.0),
                stock("b", "Technology", 0.3, 1.0),
                stock("c", "Technology", 0.3, 1.0)));
        idea.setStrategy(InvestmentStrategy.MOMENTUM);

        List<RiskFactor> factors = service.assessRisk(idea).getRiskFactors();

        assertThat(factors).extracting(RiskFactor::severity)
                .containsExactly(RiskFactor.Severity.HIGH, RiskFactor.Severity.MEDIUM);
        assertThat(factors.get(0).timeHorizon()).isEqualTo(RiskFactor.Timeframe.MEDIUM_TERM);
        assertThat(factors.get(1).probability()).isEqualTo(0.6);
    }

    @Test
    void thinVolumeDrivesLiquidityFactorAndLevel() {
        Investment thin = stock("thin", "Utilities", 0.2, 1.0);
        thin.setHistoricalPerformance(flatBars(30, 10.0, 50_000L));
        Investment liquid = stock("deep", "Energy", 0.2, 1.0);

        RiskAssessment pair = service.assessRisk(ideaOf(List.of(thin, liquid)));

        assertThat(pair.getRiskFactors()).extracting(RiskFactor::type).containsExactly(RiskFactor.Type.LIQUIDITY);
        assertThat(pair.getRiskMitigation().get(0).effectiveness()).isEqualTo(0.8);
        assertThat(pair.getLiquidityRisk().level()).isEqualTo(ExposureLevel.HIGH);
        assertThat(pair.getLiquidityRisk().averageDailyVolume()).isCloseTo(275_000.0, offset(1e-6));
        assertThat(pair.getLiquidityRisk().marketImpactCost()).isEqualTo(0.02);
        assertThat(pair.getLiquidityRisk().timeToLiquidate()).isEqualTo(5);

        List<Investment> four = List.of(thin, stock("b", "Energy", 0.2, 1.0),
                stock("c", "Retail", 0.2, 1.0), stock("d", "Media", 0.2, 1.0));
        LiquidityRisk mostlyLiquid = service.assessLiquidityRisk(four);
        assertThat(mostlyLiquid.level()).isEqualTo(ExposureLevel.MEDIUM);
        assertThat(mostlyLiquid.timeToLiquidate()).isEqualTo(2);
    }

    @Test
    void stressTestsAddOneDeclinePerSectorInOrder() {
        List<StressTestResult> results = service.assessRisk(sampleIdea()).getStressTestResults();

        assertThat(results).extracting(StressTestResult::scenario).containsExactly(
                "Market Crash (-30%)",
                "Interest Rate Shock (+200bp)",
                "Technology Sector Decline (-20%)",
                "Healthcare Sector Decline (-20%)");
        assertThat(results.get(2).timeToRecovery()).isEqualTo(270);
    }

    @Test
    void scenarioProbabilitiesSumToOne() {
        List<ScenarioRisk> scenarios = service.assessRisk(sampleIdea()).getScenarioAnalysis();

        assertThat(scenarios).hasSize(5);
        assertThat(scenarios.stream().mapToDouble(ScenarioRisk::probability).sum()).isCloseTo(1.0, offset(1e-12));
    }

    @Test
    void flagsHighlyCorrelatedPairs() {
        Investment a = stock("a", "X", 0.2, 1.0);
        Investment b = stock("b", "Y", 0.2, 1.0);
        Investment c = stock("c", "Z", 0.2, 1.0);
        a.setRiskMetrics(RiskMetrics.builder().volatility(0.2).beta(1.0).correlations(Map.of("b", 0.85, "c", 0.75)).build());
        b.setRiskMetrics(RiskMetrics.builder().volatility(0.2).beta(1.0).correlations(Map.of("c", -0.9)).build());

        List<CorrelationRisk> risks = service.assessCorrelationRisks(List.of(a, b, c));

        assertThat(risks).extracting(CorrelationRisk::assetPair).containsExactly("A - B", "A - C", "B - C");
        assertThat(risks).extracting(CorrelationRisk::riskLevel)
                .containsExactly(ExposureLevel.HIGH, ExposureLevel.MEDIUM, ExposureLevel.HIGH);
        assertThat(risks.get(2).correlation()).isEqualTo(-0.9);
        assertThat(service.assessCorrelationRisks(List.of(c, stock("d", "W", 0.2, 1.0)))).isEmpty();
    }

    @Test
    void operationalRiskReflectsComplexityAndDataQuality() {
        InvestmentIdea sample = sampleIdea();
        assertThat(service.assessOperationalRisk(sample).level()).isEqualTo(ExposureLevel.LOW);
        assertThat(service.assessOperationalRisk(sample).dataQuality()).isCloseTo(0.885, offset(1e-9));

        sample.setStrategy(InvestmentStrategy.COMPLEX);
        assertThat(service.assessOperationalRisk(sample).level()).isEqualTo(ExposureLevel.HIGH);
        assertThat(service.assessOperationalRisk(sample).processRisk()).isEqualTo(0.8);

        assertThat(service.assessOperationalRisk(emptyIdea()).level()).isEqualTo(ExposureLevel.MEDIUM);
    }

    @Test
    void concentrationLevelsFollowThresholds() {
        List<Investment> diverse = List.of(stock("a", "A", 0.1, 1), stock("b", "B", 0.1, 1), stock("c", "C", 0.1, 1),
                stock("d", "D", 0.1, 1), bond("e", 0.05));
        ConcentrationRisk risk = service.assessConcentrationRisk(diverse);

        assertThat(risk.sectorConcentration()).isZero();
        assertThat(risk.assetClassConcentration()).isCloseTo(0.6, offset(1e-12));
        assertThat(risk.singlePositionRisk()).isCloseTo(0.2, offset(1e-12));
        assertThat(risk.geographicConcentration()).isEqualTo(0.5);
        assertThat(risk.level()).isEqualTo(ExposureLevel.MEDIUM);
    }

    @Test
    void everyStrategyHasADefinedRisk() {
        for (InvestmentStrategy strategy : InvestmentStrategy.values()) {
            assertThat(service.strategyRisk(strategy)).isBetween(5.0, 25.0);
        }
        assertThat(service.strategyRisk(null)).isEqualTo(15.0);
        assertThat(service.strategyRisk(InvestmentStrategy.MOMENTUM)).isEqualTo(20.0);
    }
}
