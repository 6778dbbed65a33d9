package net.symbolrecovery.model.damage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Quantitative damage assessment of one image.
 *
 * <p>Pure function of the assessed image. Produced independently of recovery so UI and
 * CLI layers can explain why a symbol could not be read.</p>
 *
 * @param finderPatternsDetected whether enough finder-pattern candidates were found
 * @param finderPatternCandidates number of scan windows that looked like finder patterns
 * @param contrast max minus min sampled luminance, on the 0-255 scale
 * @param lowContrast whether contrast fell below the low-contrast threshold
 * @param noiseLevel mean local deviation normalized to [0,1]
 * @param highNoise whether noise exceeded the high-noise threshold
 * @param damageScore composite score in [0,1]
 * @param damageLevel severity bucket of {@code damageScore}
 * @param imageWidth width of the assessed image in pixels
 * @param imageHeight height of the assessed image in pixels
 */
public record DamageReport(
        boolean finderPatternsDetected,
        int finderPatternCandidates,
        double contrast,
        boolean lowContrast,
        double noiseLevel,
        boolean highNoise,
        double damageScore,
        DamageLevel damageLevel,
        int imageWidth,
        int imageHeight) {

    public DamageReport {
        Objects.requireNonNull(damageLevel, "damageLevel must not be null");
        if (damageScore < 0.0 || damageScore > 1.0) {
            throw new IllegalArgumentException("damageScore must be within [0,1] but was " + damageScore);
        }
        if (noiseLevel < 0.0 || noiseLevel > 1.0) {
            throw new IllegalArgumentException("noiseLevel must be within [0,1] but was " + noiseLevel);
        }
    }

    public long pixelCount() {
        return (long) imageWidth * imageHeight;
    }

    /**
     * One-line explanation of the assessment, e.g.
     * {@code "High damage (score 0.70): finder patterns not detected, low contrast (12)"}.
     */
    public String summary() {
        List<String> findings = new ArrayList<>();
        if (!finderPatternsDetected) {
            findings.add("finder patterns not detected");
        }
        if (lowContrast) {
            findings.add(String.format(Locale.ROOT, "low contrast (%.0f)", contrast));
        }
        if (highNoise) {
            findings.add(String.format(Locale.ROOT, "high noise (%.2f)", noiseLevel));
        }
        String head = String.format(Locale.ROOT, "%s damage (score %.2f)", damageLevel.label(), damageScore);
        return findings.isEmpty() ? head : head + ": " + String.join(", ", findings);
    }
}
