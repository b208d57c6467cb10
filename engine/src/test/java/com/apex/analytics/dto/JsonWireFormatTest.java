package com.apex.analytics.dto;

import com.apex.analytics.model.AssetType;
import com.apex.analytics.model.InvestmentIdea;
import com.apex.analytics.model.InvestmentStrategy;
import com.apex.analytics.model.RiskLevel;
import com.apex.analytics.model.TimeHorizon;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonWireFormatTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void enumsUseKebabCaseWireNames() throws Exception {
        assertThat(mapper.writeValueAsString(InvestmentStrategy.PAIRS_TRADE)).isEqualTo("\"pairs-trade\"");
        assertThat(mapper.writeValueAsString(RiskLevel.VERY_LOW)).isEqualTo("\"very-low\"");
        assertThat(mapper.writeValueAsString(RiskFactor.Type.INTEREST_RATE)).isEqualTo("\"interest-rate\"");
        assertThat(mapper.writeValueAsString(Recommendation.STRONG_BUY)).isEqualTo("\"strong-buy\"");

        Milestone milestone = new Milestone(LocalDate.of(2024, 9, 1), "Guidance cut", 0.3, -0.1, Milestone.Type.RISK_EVENT);
        assertThat(mapper.writeValueAsString(milestone)).contains("\"type\":\"risk-event\"");
    }

    @Test
    void readsIdeaFromWireNames() throws Exception {
        String json = """
                {"id":"idea-9","title":"Rates hedge","timeHorizon":"very-long","strategy":"pairs-trade",
                 "riskLevel":"moderate","confidenceScore":0.6,
                 "investments":[{"id":"f1","name":"Index Fund","type":"mutual-fund","currentPrice":12.5}]}
                """;

        InvestmentIdea idea = mapper.readValue(json, InvestmentIdea.class);

        assertThat(idea.getTimeHorizon()).isEqualTo(TimeHorizon.VERY_LONG);
        assertThat(idea.getStrategy()).isEqualTo(InvestmentStrategy.PAIRS_TRADE);
        assertThat(idea.getRiskLevel()).isEqualTo(RiskLevel.MODERATE);
        assertThat(idea.getInvestments()).singleElement()
                .satisfies(investment -> assertThat(investment.getType()).isEqualTo(AssetType.MUTUAL_FUND));
    }

    @Test
    void absentCreditRiskIsOmitted() throws Exception {
        RiskAssessment assessment = RiskAssessment.builder()
                .overallRiskLevel(RiskLevel.HIGH)
                .riskScore(65)
                .riskFactors(List.of())
                .build();

        String json = mapper.writeValueAsString(assessment);

        assertThat(json).doesNotContain("creditRisk").contains("\"overallRiskLevel\":\"high\"");
        assertThat(assessment.creditRiskIfPresent()).isEmpty();
    }
}
