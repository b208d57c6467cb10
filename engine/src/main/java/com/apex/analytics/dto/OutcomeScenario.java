package com.apex.analytics.dto;

import java.util.List;

/**
 * @param timeToRealization days until the scenario is expected to play out
 */
public record OutcomeScenario(
        double probability,
        double expectedReturn,
        double timeToRealization,
        List<String> keyAssumptions,
        List<String> catalysts,
        List<String> risks,
        List<Milestone> milestones
) {}
