package com.apex.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpectedOutcomeModel {
    private OutcomeScenario baseCase;
    private OutcomeScenario bullCase;
    private OutcomeScenario bearCase;
    private double probabilityWeightedReturn;
    private ConfidenceInterval confidenceInterval;
    private SensitivityAnalysis sensitivityAnalysis;
    private MonteCarloResults monteCarloResults;
    private List<TimeSeriesProjection> timeSeriesProjection;
}
