package com.apex.analytics.dto;

/**
 * @param dataQuality supporting-data quality on a 0-1 scale
 */
public record OperationalRisk(
        ExposureLevel level,
        double keyPersonRisk,
        double systemRisk,
        double processRisk,
        double externalEventRisk,
        double dataQuality
) {}
