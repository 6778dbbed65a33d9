/**
 * Record representing the outcome of one recovery run
 *
 * Features:
 * - Immutable container for decoded content and run metadata
 * - Supports both recovered and exhausted outcomes
 * - Tracks the strategy tier that succeeded and what the run cost
 * - Provides static factory methods for easy instantiation
 * - Enforces the content/confidence invariant at construction
 *
 * @param content Decoded text, or null when every strategy failed
 * @param confidence Confidence ceiling of the succeeding tier; 0 when nothing was recovered
 * @param method Label of the succeeding strategy tier, or {@value #NO_METHOD}
 * @param attemptsUsed Number of strategy tiers entered (sweep candidates count once per tier)
 * @param decodeAttempts Number of individual decode-backend invocations, sweep candidates included
 * @param processingTimeMs Wall-clock time spent in the run
 */

package net.symbolrecovery.model.recovery;

import jakarta.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

public record RecoveryResult(
        @Nullable String content,
        double confidence,
        String method,
        int attemptsUsed,
        int decodeAttempts,
        long processingTimeMs) {

    /** Method label reported when no strategy recovered content. */
    public static final String NO_METHOD = "none";

    public RecoveryResult {
        Objects.requireNonNull(method, "method must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1] but was " + confidence);
        }
        if ((content != null) != (confidence > 0.0)) {
            throw new IllegalArgumentException("content must be present exactly when confidence is positive");
        }
        if (content == null && !NO_METHOD.equals(method)) {
            throw new IllegalArgumentException("unrecovered result must report method '" + NO_METHOD + "'");
        }
        if (attemptsUsed < 1) {
            throw new IllegalArgumentException("attemptsUsed must be at least 1 but was " + attemptsUsed);
        }
        if (decodeAttempts < 0) {
            throw new IllegalArgumentException("decodeAttempts must be non-negative but was " + decodeAttempts);
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must be non-negative but was " + processingTimeMs);
        }
    }

    /**
     * Creates a result for a run where a strategy tier decoded the symbol.
     *
     * @param content The decoded text
     * @param confidence The confidence ceiling of the succeeding tier
     * @param method The label of the succeeding tier
     * @param attemptsUsed The one-based position of the succeeding tier
     * @param decodeAttempts Decode calls made up to and including the successful one
     * @param processingTimeMs Elapsed time in milliseconds
     * @return A new RecoveryResult representing a recovered symbol
     */
    public static RecoveryResult recovered(String content, double confidence, String method,
                                           int attemptsUsed, int decodeAttempts, long processingTimeMs) {
        return new RecoveryResult(Objects.requireNonNull(content, "content"), confidence, method,
            attemptsUsed, decodeAttempts, processingTimeMs);
    }

    /**
     * Creates a result for a run where every strategy tier failed.
     *
     * @param attemptsUsed Number of tiers entered, normally the full table size
     * @param decodeAttempts Decode calls made across the run
     * @param processingTimeMs Elapsed time in milliseconds
     * @return A new RecoveryResult carrying no content
     */
    public static RecoveryResult exhausted(int attemptsUsed, int decodeAttempts, long processingTimeMs) {
        return new RecoveryResult(null, 0.0, NO_METHOD, attemptsUsed, decodeAttempts, processingTimeMs);
    }

    public boolean isRecovered() {
        return content != null;
    }

    public Optional<String> contentOptional() {
        return Optional.ofNullable(content);
    }
}
