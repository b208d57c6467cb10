package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Investment {
    private String id;
    private String name;
    private String ticker;
    private String sector;
    private AssetType type;
    private double currentPrice;
    @Builder.Default
    private List<PriceBar> historicalPerformance = List.of();
    private Fundamentals fundamentals;
    private TechnicalIndicators technicalIndicators;
    private SentimentAnalysis sentimentAnalysis;
    private RiskMetrics riskMetrics;

    public boolean hasSector() {
        return sector != null && !sector.isBlank();
    }
}
