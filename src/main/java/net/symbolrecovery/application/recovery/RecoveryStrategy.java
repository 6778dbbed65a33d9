package net.symbolrecovery.application.recovery;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import net.symbolrecovery.model.decode.BinarizerKind;

/**
 * One tier of the fallback ladder: a label, the confidence reported when the tier succeeds,
 * and the ordered candidates it tries. A tier succeeds on its first successful candidate.
 *
 * @param label method label reported in the recovery result
 * @param confidenceCeiling confidence reported when this tier decodes the symbol
 * @param candidates transform and binarizer pairs, tried in list order
 */
public record RecoveryStrategy(String label, double confidenceCeiling, List<Candidate> candidates) {

    public RecoveryStrategy {
        Objects.requireNonNull(label, "label");
        if (!(confidenceCeiling > 0.0) || confidenceCeiling > 1.0) {
            throw new IllegalArgumentException("confidenceCeiling must be within (0,1] but was " + confidenceCeiling);
        }
        candidates = List.copyOf(candidates);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("strategy '" + label + "' needs at least one candidate");
        }
    }

    /**
     * A single decode attempt inside a tier.
     *
     * @param description short description for logs, e.g. {@code "rotate 90"}
     * @param transform produces the image handed to the decoder; identity passes the caller's image
     * @param binarizer binarization policy requested from the decode backend
     */
    public record Candidate(String description, UnaryOperator<BufferedImage> transform, BinarizerKind binarizer) {

        public Candidate {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(transform, "transform");
            Objects.requireNonNull(binarizer, "binarizer");
        }

        public static Candidate untransformed(BinarizerKind binarizer) {
            return new Candidate("untransformed", UnaryOperator.identity(), binarizer);
        }
    }
}
