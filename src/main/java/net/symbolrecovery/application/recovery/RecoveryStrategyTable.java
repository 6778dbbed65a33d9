package net.symbolrecovery.application.recovery;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleFunction;
import java.util.function.UnaryOperator;
import net.symbolrecovery.application.recovery.RecoveryStrategy.Candidate;
import net.symbolrecovery.model.decode.BinarizerKind;
import net.symbolrecovery.service.image.ImageTransformService;

/**
 * The fixed, ordered fallback ladder.
 *
 * <p>Cheaper and more likely strategies come first; the order is part of the contract and
 * determines both the reported confidence and the attempt count.</p>
 */
public final class RecoveryStrategyTable {

    public static final String DIRECT = "direct";
    public static final String ENHANCED = "enhanced";
    public static final String MULTI_BINARIZER = "multi-binarizer";
    public static final String ROTATION = "rotation";
    public static final String SCALING = "scaling";
    public static final String PERSPECTIVE = "perspective";
    public static final String DENOISE_SHARPEN = "denoise-sharpen";

    static final double ENHANCED_CONTRAST_FACTOR = 2.0;
    static final List<Double> ROTATION_ANGLES = List.of(90.0, 180.0, 270.0, 45.0, 135.0, 225.0, 315.0);
    static final List<Double> SCALE_FACTORS = List.of(0.5, 1.5, 2.0, 0.75, 1.25, 0.25, 3.0);
    static final List<Double> SKEW_ANGLES = List.of(-15.0, -10.0, -5.0, 5.0, 10.0, 15.0);

    private RecoveryStrategyTable() {
    }

    /**
     * Builds the default seven-tier ladder over the given transforms.
     *
     * @param transforms transform library the candidate closures call into
     * @return an immutable list of strategies in execution order
     */
    public static List<RecoveryStrategy> defaultStrategies(ImageTransformService transforms) {
        return List.of(
            new RecoveryStrategy(DIRECT, 1.0, List.of(
                Candidate.untransformed(BinarizerKind.ADAPTIVE))),
            new RecoveryStrategy(ENHANCED, 0.9, List.of(
                new Candidate("median denoise + contrast x" + ENHANCED_CONTRAST_FACTOR,
                    image -> transforms.enhanceContrast(transforms.denoiseMedian(image), ENHANCED_CONTRAST_FACTOR),
                    BinarizerKind.ADAPTIVE))),
            new RecoveryStrategy(MULTI_BINARIZER, 0.8, List.of(
                Candidate.untransformed(BinarizerKind.ADAPTIVE),
                Candidate.untransformed(BinarizerKind.GLOBAL_HISTOGRAM))),
            new RecoveryStrategy(ROTATION, 0.7, sweep("rotate", ROTATION_ANGLES,
                angle -> image -> transforms.rotate(image, angle))),
            new RecoveryStrategy(SCALING, 0.6, sweep("scale", SCALE_FACTORS,
                factor -> image -> transforms.scale(image, factor))),
            new RecoveryStrategy(PERSPECTIVE, 0.5, sweep("shear", SKEW_ANGLES,
                angle -> image -> transforms.shear(image, angle))),
            new RecoveryStrategy(DENOISE_SHARPEN, 0.4, List.of(
                new Candidate("median denoise + sharpen",
                    image -> transforms.sharpen(transforms.denoiseMedian(image)),
                    BinarizerKind.ADAPTIVE)))
        );
    }

    private static List<Candidate> sweep(String name, List<Double> parameters, DoubleFunction<UnaryOperator<BufferedImage>> transform) {
        List<Candidate> candidates = new ArrayList<>(parameters.size());
        for (Double parameter : parameters) {
            candidates.add(new Candidate(name + " " + parameter, transform.apply(parameter), BinarizerKind.ADAPTIVE));
        }
        return candidates;
    }
}
