package com.apex.analytics.dto;

public record StressTestResult(
        String scenario,
        double probability,
        double expectedLoss,
        int timeToRecovery,
        String description
) {}
