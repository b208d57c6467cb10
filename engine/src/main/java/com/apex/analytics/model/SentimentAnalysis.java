package com.apex.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentimentAnalysis {
    private Sentiment overallSentiment;
    private SentimentTrend sentimentTrend;
    private AnalystRecommendations analystRecommendations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnalystRecommendations {
        private int buy;
        private int hold;
        private int sell;

        public int total() {
            return buy + hold + sell;
        }
    }
}
