package com.apex.analytics.dto;

import com.apex.analytics.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    private RiskLevel overallRiskLevel;
    private double riskScore;
    private List<RiskFactor> riskFactors;
    private List<RiskMitigation> riskMitigation;
    private List<StressTestResult> stressTestResults;
    private List<ScenarioRisk> scenarioAnalysis;
    private List<CorrelationRisk> correlationRisks;
    private LiquidityRisk liquidityRisk;
    private ConcentrationRisk concentrationRisk;
    private MarketRisk marketRisk;
    // Only populated when the portfolio holds bonds
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private CreditRisk creditRisk;
    private OperationalRisk operationalRisk;

    public Optional<CreditRisk> creditRiskIfPresent() {
        return Optional.ofNullable(creditRisk);
    }
}
