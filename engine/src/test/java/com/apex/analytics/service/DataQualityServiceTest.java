package com.apex.analytics.service;

import com.apex.analytics.model.DataPoint;
import org.junit.jupiter.api.Test;

import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.apex.analytics.InvestmentFixtures.CLOCK;
import static com.apex.analytics.InvestmentFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class DataQualityServiceTest {

    private final DataQualityService service = new DataQualityService(CLOCK);

    @Test
    void noDataScoresThirty() {
        assertThat(service.assess(List.of())).isEqualTo(30.0);
        assertThat(service.assess(null)).isEqualTo(30.0);
    }

    @Test
    void freshReliablePrimarySourceScoresHigh() {
        DataPoint point = DataPoint.builder().source("Reuters wire").timestamp(NOW).reliability(1.0).build();

        assertThat(service.assess(List.of(point))).isCloseTo(97.0, offset(1e-9));
    }

    @Test
    void missingFieldsFallBackToConservativeValues() {
        DataPoint point = DataPoint.builder().source("anonymous blog").build();

        assertThat(service.assess(List.of(point))).isCloseTo(38.0, offset(1e-9));
    }

    @Test
    void recencyDecaysByAgeBucket() {
        assertThat(service.recencyScore(NOW.minus(12, ChronoUnit.HOURS), NOW)).isEqualTo(1.0);
        assertThat(service.recencyScore(NOW.minus(5, ChronoUnit.DAYS), NOW)).isEqualTo(0.9);
        assertThat(service.recencyScore(NOW.minus(20, ChronoUnit.DAYS), NOW)).isEqualTo(0.7);
        assertThat(service.recencyScore(NOW.minus(60, ChronoUnit.DAYS), NOW)).isEqualTo(0.5);
        assertThat(service.recencyScore(NOW.minus(200, ChronoUnit.DAYS), NOW)).isEqualTo(0.3);
        assertThat(service.recencyScore(NOW.minus(400, ChronoUnit.DAYS), NOW)).isEqualTo(0.1);
    }

    @Test
    void sourceReputationIsCaseInsensitive() {
        assertThat(service.sourceQualityScore("BLOOMBERG Terminal")).isEqualTo(0.9);
        assertThat(service.sourceQualityScore("US Treasury")).isEqualTo(0.9);
        assertThat(service.sourceQualityScore("Yahoo Finance")).isEqualTo(0.7);
        assertThat(service.sourceQualityScore("CNBC")).isEqualTo(0.7);
        assertThat(service.sourceQualityScore("Local newsletter")).isEqualTo(0.5);
        assertThat(service.sourceQualityScore(null)).isEqualTo(0.5);
    }
}
