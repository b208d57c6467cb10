package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Analyst estimate for one scenario of an idea. {@code timeToRealization} is in days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Outcome {
    private ScenarioType scenario;
    private double returnEstimate;
    private double probability;
    private double timeToRealization;
    private String description;
    @Builder.Default
    private List<String> catalysts = List.of();
    @Builder.Default
    private List<String> keyRisks = List.of();
}
