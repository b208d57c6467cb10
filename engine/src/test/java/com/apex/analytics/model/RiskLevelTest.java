package com.apex.analytics.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskLevelTest {

    @Test
    void scoreBoundariesAreInclusiveOnTheLowerLevel() {
        assertThat(RiskLevel.fromScore(0)).isEqualTo(RiskLevel.VERY_LOW);
        assertThat(RiskLevel.fromScore(20)).isEqualTo(RiskLevel.VERY_LOW);
        assertThat(RiskLevel.fromScore(20.0001)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(40)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(60)).isEqualTo(RiskLevel.MODERATE);
        assertThat(RiskLevel.fromScore(80)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(80.0001)).isEqualTo(RiskLevel.VERY_HIGH);
    }

    @Test
    void parsesWireCodes() {
        assertThat(RiskLevel.fromCode("very-high")).isEqualTo(RiskLevel.VERY_HIGH);
        assertThat(RiskLevel.fromCode(" Moderate ")).isEqualTo(RiskLevel.MODERATE);
        assertThat(RiskLevel.fromCode("")).isNull();
        assertThatThrownBy(() -> RiskLevel.fromCode("extreme")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyHighLevelsAreElevated() {
        assertThat(RiskLevel.HIGH.isElevated()).isTrue();
        assertThat(RiskLevel.VERY_HIGH.isElevated()).isTrue();
        assertThat(RiskLevel.MODERATE.isElevated()).isFalse();
    }
}
