package com.shlawgathon.leafscan.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Test
    void shouldBandScores() {
        assertThat(RiskLevel.fromScore(0.0)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(0.39)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(0.4)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(0.69)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(0.7)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(1.0)).isEqualTo(RiskLevel.HIGH);
    }
}
