package com.apex.analytics.dto;

import java.util.List;

/**
 * @param correlationMatrix square matrix indexed in the order of {@code variables}
 */
public record SensitivityAnalysis(
        List<SensitivityVariable> variables,
        double[][] correlationMatrix,
        List<String> keyDrivers
) {}
