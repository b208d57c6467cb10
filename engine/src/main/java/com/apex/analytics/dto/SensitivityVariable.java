package com.apex.analytics.dto;

/**
 * @param impact change in outcome per unit change of the variable
 */
public record SensitivityVariable(
        String name,
        double baseValue,
        double impact,
        double elasticity,
        Range range
) {
    public record Range(double min, double max) {}
}
