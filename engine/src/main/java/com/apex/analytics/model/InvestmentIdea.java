package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Unit of analysis: an equal-weighted basket of investments plus the narrative that motivates it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestmentIdea {
    private String id;
    private String title;
    @Builder.Default
    private List<Investment> investments = List.of();
    @Builder.Default
    private List<Outcome> potentialOutcomes = List.of();
    private TimeHorizon timeHorizon;
    private RiskLevel riskLevel;
    private InvestmentStrategy strategy;
    private double confidenceScore;
    @Builder.Default
    private List<DataPoint> supportingData = List.of();

    public Optional<Outcome> findOutcome(ScenarioType scenario) {
        if (potentialOutcomes == null) {
            return Optional.empty();
        }
        return potentialOutcomes.stream()
                .filter(outcome -> outcome.getScenario() == scenario)
                .findFirst();
    }
}
