package net.symbolrecovery.model.damage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DamageReportTest {

    @Test
    void should_ListEveryFinding_When_SummarizingDamagedImage() {
        DamageReport report = new DamageReport(false, 1, 12.0, true, 0.45, true, 1.0, DamageLevel.SEVERE, 80, 60);

        assertThat(report.summary())
            .isEqualTo("Severe damage (score 1.00): finder patterns not detected, low contrast (12), high noise (0.45)");
        assertThat(report.pixelCount()).isEqualTo(4800L);
    }

    @Test
    void should_OmitFindings_When_NothingWasFlagged() {
        DamageReport report = new DamageReport(true, 12, 255.0, false, 0.05, false, 0.0, DamageLevel.LOW, 10, 10);

        assertThat(report.summary()).isEqualTo("Low damage (score 0.00)");
    }

    @Test
    void should_Throw_When_ScoreIsOutOfRange() {
        assertThatThrownBy(() -> new DamageReport(true, 3, 100.0, false, 0.1, false, 1.2, DamageLevel.SEVERE, 1, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("damageScore");
    }
}
