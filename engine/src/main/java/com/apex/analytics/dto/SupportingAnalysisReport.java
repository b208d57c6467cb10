package com.apex.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportingAnalysisReport {
    private String ideaId;
    private Instant generatedAt;
    private KeyMetrics keyMetrics;
    private RiskAssessment riskAssessment;
    private ExpectedOutcomeModel outcomeModel;
    private double overallQualityScore;
    private double riskAdjustedReturn;
    private Recommendation recommendation;
    private List<String> keyConsiderations;
}
