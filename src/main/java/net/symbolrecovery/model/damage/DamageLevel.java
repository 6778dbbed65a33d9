package net.symbolrecovery.model.damage;

/**
 * Severity buckets for a composite damage score.
 *
 * <p>Buckets are half-open on the upper bound: a score of exactly 0.3 is already
 * {@link #MEDIUM}, 0.6 is {@link #HIGH} and 0.8 is {@link #SEVERE}.</p>
 */
public enum DamageLevel {

    LOW("Low", 0.3),
    MEDIUM("Medium", 0.6),
    HIGH("High", 0.8),
    SEVERE("Severe", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBoundExclusive;

    DamageLevel(String label, double upperBoundExclusive) {
        this.label = label;
        this.upperBoundExclusive = upperBoundExclusive;
    }

    /** Display label, e.g. for UI badges. */
    public String label() {
        return label;
    }

    /**
     * Buckets a damage score.
     *
     * @param score composite score, expected in [0,1]
     * @return the first level whose upper bound exceeds the score
     */
    public static DamageLevel fromScore(double score) {
        for (DamageLevel level : values()) {
            if (score < level.upperBoundExclusive) {
                return level;
            }
        }
        return SEVERE;
    }
}
