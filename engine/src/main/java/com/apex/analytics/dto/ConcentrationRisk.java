package com.apex.analytics.dto;

public record ConcentrationRisk(
        ExposureLevel level,
        double sectorConcentration,
        double geographicConcentration,
        double assetClassConcentration,
        double singlePositionRisk
) {}
