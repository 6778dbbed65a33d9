package net.symbolrecovery.service.damage;

import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.PrimitiveIterator;
import net.symbolrecovery.model.damage.DamageLevel;
import net.symbolrecovery.model.damage.DamageReport;
import net.symbolrecovery.util.image.ImageInputValidator;
import net.symbolrecovery.util.image.LuminanceAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Estimates how badly a symbol image is damaged, independently of any decode attempt.
 *
 * <p>Three heuristics feed a weighted score:</p>
 * <ul>
 *   <li>finder patterns: short horizontal and vertical scan windows are binarized at
 *       {@value #DARK_THRESHOLD} and a window with {@value #MIN_WINDOW_TRANSITIONS} to
 *       {@value #MAX_WINDOW_TRANSITIONS} dark/light transitions counts as a candidate. This
 *       approximates the 1:1:3:1:1 finder ratio without geometric matching.</li>
 *   <li>contrast: luminance range over the pixels chosen by the injected {@link PixelSampler}.</li>
 *   <li>noise: mean absolute difference between each interior pixel and its 4-neighborhood.</li>
 * </ul>
 */
@Service
public class DamageAssessmentService {

    private static final Logger logger = LoggerFactory.getLogger(DamageAssessmentService.class);

    static final int DARK_THRESHOLD = 128;
    static final int WINDOW_LENGTH = 15;
    static final int LINE_STEP = 10;
    static final int WINDOW_STEP = 5;
    /** Window starts stop this far before the far edge. */
    static final int SCAN_EDGE_MARGIN = 20;
    static final int MIN_WINDOW_TRANSITIONS = 4;
    static final int MAX_WINDOW_TRANSITIONS = 8;
    static final int MIN_FINDER_CANDIDATES = 3;

    static final double LOW_CONTRAST_THRESHOLD = 50.0;
    static final double HIGH_NOISE_THRESHOLD = 0.3;

    static final double MISSING_FINDER_WEIGHT = 0.4;
    static final double LOW_CONTRAST_WEIGHT = 0.3;
    static final double HIGH_NOISE_WEIGHT = 0.3;

    private final PixelSampler contrastSampler;

    public DamageAssessmentService(PixelSampler contrastSampler) {
        this.contrastSampler = contrastSampler;
    }

    /**
     * Assesses one image.
     *
     * @param image the image to analyze; never modified
     * @return the damage report
     * @throws net.symbolrecovery.exception.InvalidImageException if the image is null or empty
     */
    public DamageReport assess(BufferedImage image) {
        ImageInputValidator.requireUsable(image, "assess");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] luminance = LuminanceAnalyzer.toLuminance(image);

        int candidates = countFinderCandidates(luminance, width, height);
        boolean finderPatternsDetected = candidates >= MIN_FINDER_CANDIDATES;

        double contrast = estimateContrast(luminance, width, height);
        boolean lowContrast = isLowContrast(contrast);

        double noiseLevel = estimateNoiseLevel(luminance, width, height);
        boolean highNoise = isHighNoise(noiseLevel);

        double score = damageScore(finderPatternsDetected, lowContrast, highNoise);
        DamageLevel level = DamageLevel.fromScore(score);

        DamageReport report = new DamageReport(finderPatternsDetected, candidates, contrast, lowContrast,
            noiseLevel, highNoise, score, level, width, height);
        if (logger.isDebugEnabled()) {
            logger.debug("Assessed {}x{} image: {} (finder candidates={}, contrast={}, noise={}).",
                width, height, report.summary(), candidates, contrast,
                String.format(Locale.ROOT, "%.3f", noiseLevel));
        }
        return report;
    }

    static boolean isLowContrast(double contrast) {
        return contrast < LOW_CONTRAST_THRESHOLD;
    }

    static boolean isHighNoise(double noiseLevel) {
        return noiseLevel > HIGH_NOISE_THRESHOLD;
    }

    static double damageScore(boolean finderPatternsDetected, boolean lowContrast, boolean highNoise) {
        double score = 0.0;
        if (!finderPatternsDetected) {
            score += MISSING_FINDER_WEIGHT;
        }
        if (lowContrast) {
            score += LOW_CONTRAST_WEIGHT;
        }
        if (highNoise) {
            score += HIGH_NOISE_WEIGHT;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    int countFinderCandidates(int[] luminance, int width, int height) {
        int candidates = 0;
        // Horizontal windows along every LINE_STEP-th row
        for (int y = 0; y < height; y += LINE_STEP) {
            for (int x = 0; x < width - SCAN_EDGE_MARGIN; x += WINDOW_STEP) {
                if (isFinderCandidate(luminance, width, height, x, y, true)) {
                    candidates++;
                }
            }
        }
        // Vertical windows along every LINE_STEP-th column
        for (int x = 0; x < width; x += LINE_STEP) {
            for (int y = 0; y < height - SCAN_EDGE_MARGIN; y += WINDOW_STEP) {
                if (isFinderCandidate(luminance, width, height, x, y, false)) {
                    candidates++;
                }
            }
        }
        return candidates;
    }

    private static boolean isFinderCandidate(int[] luminance, int width, int height,
                                             int startX, int startY, boolean horizontal) {
        int transitions = 0;
        boolean previousDark = false;
        for (int i = 0; i < WINDOW_LENGTH; i++) {
            int x = horizontal ? startX + i : startX;
            int y = horizontal ? startY : startY + i;
            if (x >= width || y >= height) {
                return false;
            }
            boolean dark = luminance[y * width + x] < DARK_THRESHOLD;
            if (i > 0 && dark != previousDark) {
                transitions++;
            }
            previousDark = dark;
        }
        return transitions >= MIN_WINDOW_TRANSITIONS && transitions <= MAX_WINDOW_TRANSITIONS;
    }

    double estimateContrast(int[] luminance, int width, int height) {
        int min = 255;
        int max = 0;
        PrimitiveIterator.OfInt samples = contrastSampler.sampleIndices(width, height).iterator();
        boolean sampled = false;
        while (samples.hasNext()) {
            int value = luminance[samples.nextInt()];
            min = Math.min(min, value);
            max = Math.max(max, value);
            sampled = true;
        }
        return sampled ? max - min : 0.0;
    }

    static double estimateNoiseLevel(int[] luminance, int width, int height) {
        if (width < 3 || height < 3) {
            // No interior pixels
            return 0.0;
        }
        double totalVariation = 0.0;
        long samples = 0;
        for (int y = 1; y < height - 1; y++) {
            int row = y * width;
            for (int x = 1; x < width - 1; x++) {
                int center = luminance[row + x];
                double neighborMean = (luminance[row + x - 1] + luminance[row + x + 1]
                    + luminance[row - width + x] + luminance[row + width + x]) / 4.0;
                totalVariation += Math.abs(center - neighborMean);
                samples++;
            }
        }
        return (totalVariation / samples) / 255.0;
    }
}
