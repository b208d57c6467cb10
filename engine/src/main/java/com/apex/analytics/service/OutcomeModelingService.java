package com.apex.analytics.service;

import com.apex.analytics.config.AnalyticsProperties;
import com.apex.analytics.dto.ConfidenceInterval;
import com.apex.analytics.dto.ExpectedOutcomeModel;
import com.apex.analytics.dto.Milestone;
import com.apex.analytics.dto.MonteCarloResults;
import com.apex.analytics.dto.OutcomeScenario;
import com.apex.analytics.dto.SensitivityAnalysis;
import com.apex.analytics.dto.SensitivityVariable;
import com.apex.analytics.dto.TimeSeriesProjection;
import com.apex.analytics.model.Investment;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.Outcome;
import com.apex.analytics.model.ScenarioType;
import com.apex.analytics.service.simulation.MonteCarloSimulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Probabilistic outcome model for an idea: base/bull/bear scenarios with milestones,
 * a confidence interval, sensitivity analysis, a Monte Carlo return distribution and a
 * daily projection with confidence bands.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeModelingService {

    private static final double Z_95 = 1.96;
    private static final int REVIEW_INTERVAL_DAYS = 90;

    private static final double BASE_PROBABILITY = 0.6;
    private static final double BULL_PROBABILITY = 0.2;
    private static final double BEAR_PROBABILITY = 0.2;

    private final AnalyticsProperties properties;
    private final PortfolioStatistics statistics;
    private final MonteCarloSimulator monteCarloSimulator;
    private final Clock clock;

    /**
     * Models the idea with a generator seeded from {@code analytics.monte-carlo.seed} when set,
     * otherwise with a fresh unseeded generator.
     */
    public ExpectedOutcomeModel modelExpectedOutcomes(InvestmentIdea idea) {
        Long seed = properties.getMonteCarlo().getSeed();
        return modelExpectedOutcomes(idea, seed != null ? new Random(seed) : new Random());
    }

    public ExpectedOutcomeModel modelExpectedOutcomes(InvestmentIdea idea, RandomGenerator random) {
        List<Investment> investments = statistics.investments(idea);
        int holdingPeriod = statistics.holdingPeriodDays(idea != null ? idea.getTimeHorizon() : null);
        LocalDate today = LocalDate.now(clock);

        OutcomeScenario baseCase = createScenario(idea, Scenario.BASE, holdingPeriod, today);
        OutcomeScenario bullCase = createScenario(idea, Scenario.BULL, holdingPeriod, today);
        OutcomeScenario bearCase = createScenario(idea, Scenario.BEAR, holdingPeriod, today);

        double weightedReturn = 0.0;
        for (OutcomeScenario scenario : List.of(baseCase, bullCase, bearCase)) {
            weightedReturn += scenario.expectedReturn() * scenario.probability();
        }

        double volatility = statistics.averageVolatility(investments);
        AnalyticsProperties.MonteCarlo monteCarlo = properties.getMonteCarlo();
        MonteCarloResults simulation = monteCarloSimulator.simulate(statistics.expectedReturn(idea), volatility,
                monteCarlo.getIterations(), monteCarlo.getTargetReturn(), random);

        ExpectedOutcomeModel model = ExpectedOutcomeModel.builder()
                .baseCase(baseCase)
                .bullCase(bullCase)
                .bearCase(bearCase)
                .probabilityWeightedReturn(PortfolioStatistics.finiteOrZero(weightedReturn))
                .confidenceInterval(calculateConfidenceInterval(investments, volatility))
                .sensitivityAnalysis(sensitivityAnalysis())
                .monteCarloResults(simulation)
                .timeSeriesProjection(projectTimeSeries(holdingPeriod, simulation, today))
                .build();

        log.debug("Outcome model for idea {}: weightedReturn={}, simulatedMean={}, probabilityOfLoss={}",
                idea != null ? idea.getId() : null, weightedReturn, simulation.meanReturn(), simulation.probabilityOfLoss());
        return model;
    }

    OutcomeScenario createScenario(InvestmentIdea idea, Scenario scenario, int holdingPeriod, LocalDate today) {
        Optional<Outcome> outcome = idea != null ? idea.findOutcome(scenario.source) : Optional.empty();
        double expectedReturn = outcome.map(Outcome::getReturnEstimate).orElse(scenario.defaultReturn);
        double timeToRealization = outcome.map(Outcome::getTimeToRealization).orElse((double) holdingPeriod)
                * scenario.timeFactor;
        List<Milestone> milestones = generateMilestones(scenario, holdingPeriod, today);

        return switch (scenario) {
            case BASE -> new OutcomeScenario(BASE_PROBABILITY, expectedReturn, timeToRealization,
                    List.of("Market conditions remain stable",
                            "Company fundamentals improve as expected",
                            "No major external shocks"),
                    outcome.map(Outcome::getCatalysts).orElse(List.of("Earnings growth", "Market expansion")),
                    outcome.map(Outcome::getKeyRisks).orElse(List.of("Market volatility", "Execution risk")),
                    milestones);
            case BULL -> new OutcomeScenario(BULL_PROBABILITY, expectedReturn, timeToRealization,
                    List.of("Favorable market conditions",
                            "Strong execution of business plan",
                            "Positive regulatory environment"),
                    outcome.map(Outcome::getCatalysts)
                            .orElse(List.of("Strong earnings beat", "Market leadership", "Strategic partnerships")),
                    List.of("Overvaluation", "Market correction"),
                    milestones);
            case BEAR -> new OutcomeScenario(BEAR_PROBABILITY, expectedReturn, timeToRealization,
                    List.of("Adverse market conditions",
                            "Execution challenges",
                            "Regulatory headwinds"),
                    List.of("Earnings miss", "Competitive pressure", "Economic downturn"),
                    outcome.map(Outcome::getKeyRisks).orElse(List.of("Significant losses", "Liquidity issues")),
                    milestones);
        };
    }

    List<Milestone> generateMilestones(Scenario scenario, int holdingPeriod, LocalDate today) {
        List<Milestone> milestones = new ArrayList<>();
        int reviews = (holdingPeriod + REVIEW_INTERVAL_DAYS - 1) / REVIEW_INTERVAL_DAYS;
        for (int i = 1; i <= reviews; i++) {
            milestones.add(new Milestone(
                    today.plusDays((long) REVIEW_INTERVAL_DAYS * i),
                    "Q" + i + " Performance Review",
                    scenario.reviewProbability,
                    scenario.reviewImpact,
                    Milestone.Type.DECISION_POINT));
        }
        milestones.add(new Milestone(
                today.plusDays(holdingPeriod / 2),
                "Major Market Event",
                0.3,
                scenario.marketEventImpact,
                Milestone.Type.MARKET_EVENT));
        return milestones;
    }

    ConfidenceInterval calculateConfidenceInterval(List<Investment> investments, double volatility) {
        double center = statistics.historicalExpectedReturn(investments);
        double standardError = volatility / Math.sqrt(properties.getAssumptions().getTradingDaysPerYear());
        return new ConfidenceInterval(0.95, center - Z_95 * standardError, center + Z_95 * standardError, standardError);
    }

    SensitivityAnalysis sensitivityAnalysis() {
        List<SensitivityVariable> variables = List.of(
                new SensitivityVariable("Market Return", 0.08, 1.2, 1.5, new SensitivityVariable.Range(-0.30, 0.30)),
                new SensitivityVariable("Interest Rates", 0.05, -0.8, -1.2, new SensitivityVariable.Range(0.01, 0.10)),
                new SensitivityVariable("Volatility", 0.20, -0.3, -0.5, new SensitivityVariable.Range(0.10, 0.50))
        );
        double[][] correlationMatrix = {
                {1.0, -0.3, 0.6},
                {-0.3, 1.0, -0.2},
                {0.6, -0.2, 1.0}
        };
        return new SensitivityAnalysis(variables, correlationMatrix, List.of("Market Return", "Interest Rates"));
    }

    List<TimeSeriesProjection> projectTimeSeries(int holdingPeriod, MonteCarloResults simulation, LocalDate today) {
        int tradingDays = properties.getAssumptions().getTradingDaysPerYear();
        int steps = Math.min(holdingPeriod, properties.getProjection().getMaxDays());
        double dailyReturn = simulation.meanReturn() / tradingDays;
        double dailyVolatility = simulation.standardDeviation() / Math.sqrt(tradingDays);

        List<TimeSeriesProjection> projections = new ArrayList<>(steps);
        double cumulativeReturn = 0.0;
        for (int i = 1; i <= steps; i++) {
            double expectedValue = dailyReturn * i;
            double spread = dailyVolatility * Math.sqrt(i);
            cumulativeReturn += dailyReturn;
            projections.add(new TimeSeriesProjection(
                    today.plusDays(i),
                    expectedValue,
                    new TimeSeriesProjection.ConfidenceBands(
                            expectedValue + Z_95 * spread,
                            expectedValue + spread,
                            expectedValue - spread,
                            expectedValue - Z_95 * spread),
                    cumulativeReturn));
        }
        return projections;
    }

    enum Scenario {
        BASE(ScenarioType.EXPECTED, 0.08, 1.0, 0.6, 0.02, -0.05),
        BULL(ScenarioType.BEST, 0.20, 0.8, 0.8, 0.05, 0.10),
        BEAR(ScenarioType.WORST, -0.15, 1.5, 0.4, -0.03, -0.15);

        private final ScenarioType source;
        private final double defaultReturn;
        private final double timeFactor;
        private final double reviewProbability;
        private final double reviewImpact;
        private final double marketEventImpact;

        Scenario(ScenarioType source, double defaultReturn, double timeFactor,
                 double reviewProbability, double reviewImpact, double marketEventImpact) {
            this.source = source;
            this.defaultReturn = defaultReturn;
            this.timeFactor = timeFactor;
            this.reviewProbability = reviewProbability;
            this.reviewImpact = reviewImpact;
            this.marketEventImpact = marketEventImpact;
        }
    }
}
