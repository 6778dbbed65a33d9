package net.symbolrecovery.application.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.function.UnaryOperator;
import net.symbolrecovery.model.decode.BinarizerKind;
import net.symbolrecovery.service.image.ImageTransformService;
import net.symbolrecovery.testutil.QrFixtures;
import org.junit.jupiter.api.Test;

class RecoveryStrategyTableTest {

    private final List<RecoveryStrategy> strategies =
        RecoveryStrategyTable.defaultStrategies(new ImageTransformService());

    @Test
    void should_OrderTiersByDescendingConfidence_When_BuildingDefaultTable() {
        assertThat(strategies).extracting(RecoveryStrategy::label).containsExactly(
            "direct", "enhanced", "multi-binarizer", "rotation", "scaling", "perspective", "denoise-sharpen");
        assertThat(strategies).extracting(RecoveryStrategy::confidenceCeiling)
            .containsExactly(1.0, 0.9, 0.8, 0.7, 0.6, 0.5, 0.4);
    }

    @Test
    void should_SweepDocumentedParameters_When_TierIsASweep() {
        assertThat(strategies.get(3).candidates()).extracting(RecoveryStrategy.Candidate::description)
            .containsExactly("rotate 90.0", "rotate 180.0", "rotate 270.0", "rotate 45.0",
                "rotate 135.0", "rotate 225.0", "rotate 315.0");
        assertThat(strategies.get(4).candidates()).hasSize(7);
        assertThat(strategies.get(5).candidates()).hasSize(6);
        assertThat(strategies.stream().mapToInt(strategy -> strategy.candidates().size()).sum()).isEqualTo(25);
    }

    @Test
    void should_TryBothBinarizersOnUntransformedImage_When_MultiBinarizerTierRuns() {
        RecoveryStrategy multi = strategies.get(2);
        BufferedImage image = QrFixtures.solid(128, 5, 5);

        assertThat(multi.candidates()).extracting(RecoveryStrategy.Candidate::binarizer)
            .containsExactly(BinarizerKind.ADAPTIVE, BinarizerKind.GLOBAL_HISTOGRAM);
        assertThat(multi.candidates().get(1).transform().apply(image)).isSameAs(image);
    }

    @Test
    void should_ProduceSwappedCanvas_When_FirstRotationCandidateApplies() {
        BufferedImage rotated = strategies.get(3).candidates().get(0).transform()
            .apply(QrFixtures.solid(255, 30, 20));

        assertThat(rotated.getWidth()).isEqualTo(20);
        assertThat(rotated.getHeight()).isEqualTo(30);
    }

    @Test
    void should_RejectInvalidStrategies_When_Constructing() {
        List<RecoveryStrategy.Candidate> one = List.of(RecoveryStrategy.Candidate.untransformed(BinarizerKind.ADAPTIVE));

        assertThatThrownBy(() -> new RecoveryStrategy("zero", 0.0, one))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecoveryStrategy("over", 1.1, one))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecoveryStrategy("empty", 0.5, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecoveryStrategy.Candidate("no-op", UnaryOperator.identity(), null))
            .isInstanceOf(NullPointerException.class);
    }
}
