package com.apex.analytics.dto;

public record CreditRisk(
        String creditRating,
        double defaultProbability,
        double recoveryRate,
        double creditSpread
) {}
