package net.symbolrecovery.service.damage;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.stream.IntStream;
import net.symbolrecovery.exception.InvalidImageException;
import net.symbolrecovery.model.damage.DamageLevel;
import net.symbolrecovery.model.damage.DamageReport;
import net.symbolrecovery.testutil.QrFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DamageAssessmentServiceTest {

    private final DamageAssessmentService fullScanAssessor = new DamageAssessmentService(new FullScanPixelSampler());

    @Test
    void should_ReportHighDamage_When_ImageIsUniformGray() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.solid(128, 100, 100));

        assertThat(report.finderPatternsDetected()).isFalse();
        assertThat(report.finderPatternCandidates()).isZero();
        assertThat(report.contrast()).isZero();
        assertThat(report.lowContrast()).isTrue();
        assertThat(report.noiseLevel()).isZero();
        assertThat(report.highNoise()).isFalse();
        assertThat(report.damageScore()).isCloseTo(0.7, within(1e-9));
        assertThat(report.damageLevel()).isEqualTo(DamageLevel.HIGH);
        assertThat(report.pixelCount()).isEqualTo(10_000L);
    }

    @Test
    void should_FlagHighNoise_When_ImageIsPixelCheckerboard() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.checkerboard(100, 100));

        // Every window flips on each pixel, far above the finder transition range
        assertThat(report.finderPatternsDetected()).isFalse();
        assertThat(report.contrast()).isEqualTo(255.0);
        assertThat(report.lowContrast()).isFalse();
        assertThat(report.noiseLevel()).isCloseTo(1.0, within(1e-9));
        assertThat(report.highNoise()).isTrue();
        assertThat(report.damageLevel()).isEqualTo(DamageLevel.HIGH);
    }

    @Test
    void should_DetectFinderPatterns_When_StripesAlternateEveryTwoPixels() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.verticalStripes(2, 100, 100));

        assertThat(report.finderPatternCandidates()).isGreaterThanOrEqualTo(3);
        assertThat(report.finderPatternsDetected()).isTrue();
        // One of four neighbors differs by 255
        assertThat(report.noiseLevel()).isCloseTo(0.25, within(1e-9));
        assertThat(report.highNoise()).isFalse();
        assertThat(report.damageScore()).isZero();
        assertThat(report.damageLevel()).isEqualTo(DamageLevel.LOW);
    }

    @Test
    void should_MeasureFullContrast_When_SymbolHasTransparentBackground() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.transparentQrCode("Hello World", 300));

        assertThat(report.contrast()).isEqualTo(255.0);
        assertThat(report.lowContrast()).isFalse();
        assertThat(report.damageLevel()).isNotEqualTo(DamageLevel.HIGH);
    }

    @Test
    void should_IgnoreWideStripes_When_TooFewTransitionsPerWindow() {
        BufferedImage image = QrFixtures.verticalStripes(10, 100, 100);

        assertThat(fullScanAssessor.assess(image).finderPatternsDetected()).isFalse();
    }

    @Test
    void should_NotFlagLowContrast_When_ContrastIsExactlyFifty() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.split(100, 150, 40, 40));

        assertThat(report.contrast()).isEqualTo(50.0);
        assertThat(report.lowContrast()).isFalse();
    }

    @Test
    void should_FlagLowContrast_When_ContrastIsFortyNine() {
        DamageReport report = fullScanAssessor.assess(QrFixtures.split(100, 149, 40, 40));

        assertThat(report.contrast()).isEqualTo(49.0);
        assertThat(report.lowContrast()).isTrue();
    }

    @Test
    void should_UseInjectedSampler_When_EstimatingContrast() {
        PixelSampler sampler = mock(PixelSampler.class);
        // Only the two left-most pixels of the first row, both at luminance 100
        when(sampler.sampleIndices(40, 40)).thenReturn(IntStream.of(0, 1));
        DamageAssessmentService assessor = new DamageAssessmentService(sampler);

        DamageReport report = assessor.assess(QrFixtures.split(100, 200, 40, 40));

        verify(sampler).sampleIndices(40, 40);
        assertThat(report.contrast()).isZero();
        assertThat(report.lowContrast()).isTrue();
    }

    @Test
    void should_ProduceIdenticalReports_When_SamplerIsSeeded() {
        DamageAssessmentService seeded = new DamageAssessmentService(new RandomPixelSampler(50, 42L));
        BufferedImage image = QrFixtures.qrCode("seeded", 120);

        assertThat(seeded.assess(image)).isEqualTo(seeded.assess(image));
    }

    @Test
    void should_TreatNoiseOfExactlyPointThreeAsNotHigh() {
        assertThat(DamageAssessmentService.isHighNoise(0.3)).isFalse();
        assertThat(DamageAssessmentService.isHighNoise(0.3000001)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "true,  false, false, 0.0, LOW",
        "true,  true,  false, 0.3, MEDIUM",
        "false, false, false, 0.4, MEDIUM",
        "true,  true,  true,  0.6, HIGH",
        "false, true,  false, 0.7, HIGH",
        "false, true,  true,  1.0, SEVERE"
    })
    void should_WeightFindingsIntoLevel_When_Scoring(boolean finder, boolean lowContrast, boolean highNoise,
                                                     double expectedScore, DamageLevel expectedLevel) {
        double score = DamageAssessmentService.damageScore(finder, lowContrast, highNoise);

        assertThat(score).isCloseTo(expectedScore, within(1e-9));
        assertThat(DamageLevel.fromScore(score)).isEqualTo(expectedLevel);
    }

    @Test
    void should_ReportZeroNoise_When_ImageHasNoInteriorPixels() {
        assertThat(DamageAssessmentService.estimateNoiseLevel(new int[] {0, 255, 255, 0}, 2, 2)).isZero();
        assertThat(fullScanAssessor.assess(QrFixtures.checkerboard(2, 50)).noiseLevel()).isZero();
    }

    @Test
    void should_FormatDebugLineIndependentOfLocale_When_DefaultLocaleUsesDecimalComma() {
        Logger logger = (Logger) LoggerFactory.getLogger(DamageAssessmentService.class);
        Level previousLevel = logger.getLevel();
        Locale previousLocale = Locale.getDefault();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        Locale.setDefault(Locale.GERMANY);
        try {
            fullScanAssessor.assess(QrFixtures.solid(128, 30, 30));
        } finally {
            Locale.setDefault(previousLocale);
            logger.setLevel(previousLevel);
            logger.detachAppender(appender);
        }

        assertThat(appender.list).singleElement()
            .extracting(ILoggingEvent::getFormattedMessage)
            .asString()
            .contains("score 0.70", "noise=0.000");
    }

    @Test
    void should_SkipDebugSummary_When_DebugLoggingIsOff() {
        Logger logger = (Logger) LoggerFactory.getLogger(DamageAssessmentService.class);
        Level previousLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.INFO);
        try {
            fullScanAssessor.assess(QrFixtures.solid(128, 30, 30));
        } finally {
            logger.setLevel(previousLevel);
            logger.detachAppender(appender);
        }

        assertThat(appender.list).isEmpty();
    }

    @Test
    void should_Throw_When_ImageIsNull() {
        assertThatThrownBy(() -> fullScanAssessor.assess(null))
            .isInstanceOf(InvalidImageException.class)
            .hasMessageContaining("assess");
    }

    @Test
    void should_NotMutateInput_When_Assessing() {
        BufferedImage image = QrFixtures.checkerboard(20, 20);

        fullScanAssessor.assess(image);

        assertThat(QrFixtures.grayAt(image, 0, 0)).isZero();
        assertThat(QrFixtures.grayAt(image, 1, 0)).isEqualTo(255);
    }
}
