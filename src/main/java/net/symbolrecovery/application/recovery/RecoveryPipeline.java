package net.symbolrecovery.application.recovery;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import net.symbolrecovery.application.recovery.RecoveryStrategy.Candidate;
import net.symbolrecovery.model.decode.DecodeOutcome;
import net.symbolrecovery.model.decode.DecodeStatus;
import net.symbolrecovery.model.recovery.RecoveryResult;
import net.symbolrecovery.service.decode.DecodeBackend;
import net.symbolrecovery.service.image.ImageTransformService;
import net.symbolrecovery.util.image.ImageInputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs the fallback ladder against one image until a strategy decodes the symbol.
 *
 * <p>Strategies run strictly in table order and the first success wins; no later tier is
 * tried in search of a higher confidence. {@code attemptsUsed} counts strategy tiers, so a
 * rotation sweep that tries seven angles still costs one attempt; the number of individual
 * decoder calls is reported separately as {@code decodeAttempts}.</p>
 *
 * <p>Transform and decoder failures are contained per candidate and never reach the caller.
 * The only caller-visible failure is a result without content. The pipeline keeps no mutable
 * state, so one instance can serve concurrent callers.</p>
 */
@Service
public class RecoveryPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryPipeline.class);

    /** Structured codes for contained strategy failures. */
    enum RecoveryFailureCode {
        TRANSFORM_FAILED("RECOVERY_TRANSFORM_FAILED"),
        DECODE_FAILED("RECOVERY_DECODE_FAILED"),
        DECODE_ERROR_REPORTED("RECOVERY_DECODE_ERROR_REPORTED"),
        STRATEGY_EXHAUSTED("RECOVERY_STRATEGY_EXHAUSTED"),
        PIPELINE_EXHAUSTED("RECOVERY_PIPELINE_EXHAUSTED");

        private final String code;
        RecoveryFailureCode(String code) { this.code = code; }
        String code() { return code; }
    }

    static final String DURATION_METER = "symbol.recovery.duration";
    static final String OUTCOME_METER = "symbol.recovery.outcome";
    static final String STRATEGY_FAILURE_METER = "symbol.recovery.strategy.failures";

    private final DecodeBackend decodeBackend;
    private final List<RecoveryStrategy> strategies;
    private final MeterRegistry meterRegistry;
    private final Timer recoveryDuration;

    /**
     * Creates the pipeline with the default strategy ladder.
     */
    @Autowired
    public RecoveryPipeline(DecodeBackend decodeBackend,
                            ImageTransformService transforms,
                            MeterRegistry meterRegistry) {
        this(decodeBackend, RecoveryStrategyTable.defaultStrategies(transforms), meterRegistry);
    }

    /**
     * Creates the pipeline with an explicit strategy ladder.
     */
    public RecoveryPipeline(DecodeBackend decodeBackend,
                            List<RecoveryStrategy> strategies,
                            MeterRegistry meterRegistry) {
        this.decodeBackend = Objects.requireNonNull(decodeBackend, "decodeBackend");
        this.strategies = List.copyOf(strategies);
        if (this.strategies.isEmpty()) {
            throw new IllegalArgumentException("recovery pipeline needs at least one strategy");
        }
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.recoveryDuration = meterRegistry.timer(DURATION_METER);
    }

    /**
     * Decodes the symbol in the image, falling back through the strategy ladder.
     *
     * @param image the caller's image; never modified
     * @return the outcome of the first successful strategy, or an exhausted result
     * @throws net.symbolrecovery.exception.InvalidImageException if the image is null or empty
     */
    public RecoveryResult recover(BufferedImage image) {
        ImageInputValidator.requireUsable(image, "recover");
        long startNanos = System.nanoTime();
        int decodeAttempts = 0;

        for (int tier = 0; tier < strategies.size(); tier++) {
            RecoveryStrategy strategy = strategies.get(tier);
            for (Candidate candidate : strategy.candidates()) {
                Optional<BufferedImage> prepared = prepare(strategy, candidate, image);
                if (prepared.isEmpty()) {
                    continue;
                }
                decodeAttempts++;
                Optional<String> decoded = decode(strategy, candidate, prepared.get());
                if (decoded.isPresent()) {
                    long elapsedMs = elapsedMillis(startNanos);
                    recordOutcome(strategy.label(), startNanos);
                    logger.info("Recovered symbol with strategy '{}' ({}) after {} tier(s), {} decode call(s), {} ms.",
                        strategy.label(), candidate.description(), tier + 1, decodeAttempts, elapsedMs);
                    return RecoveryResult.recovered(decoded.get(), strategy.confidenceCeiling(),
                        strategy.label(), tier + 1, decodeAttempts, elapsedMs);
                }
            }
            meterRegistry.counter(STRATEGY_FAILURE_METER, "strategy", strategy.label()).increment();
            logger.debug("Strategy '{}' found no symbol [code={}]: reason={}",
                strategy.label(),
                RecoveryFailureCode.STRATEGY_EXHAUSTED.code(),
                "all-candidates-failed");
        }

        long elapsedMs = elapsedMillis(startNanos);
        recordOutcome(RecoveryResult.NO_METHOD, startNanos);
        logger.info("No symbol recovered from {}x{} image after {} strategies, {} decode call(s), {} ms [code={}].",
            image.getWidth(), image.getHeight(), strategies.size(), decodeAttempts, elapsedMs,
            RecoveryFailureCode.PIPELINE_EXHAUSTED.code());
        return RecoveryResult.exhausted(strategies.size(), decodeAttempts, elapsedMs);
    }

    /** The strategy ladder in execution order. */
    public List<RecoveryStrategy> strategies() {
        return strategies;
    }

    private Optional<BufferedImage> prepare(RecoveryStrategy strategy, Candidate candidate, BufferedImage image) {
        try {
            return Optional.of(candidate.transform().apply(image));
        } catch (RuntimeException e) {
            logger.debug("Transform '{}' of strategy '{}' failed [code={}]: reason={}",
                candidate.description(),
                strategy.label(),
                RecoveryFailureCode.TRANSFORM_FAILED.code(),
                resolveFailureReason(e),
                e);
            return Optional.empty();
        }
    }

    private Optional<String> decode(RecoveryStrategy strategy, Candidate candidate, BufferedImage prepared) {
        DecodeOutcome outcome;
        try {
            outcome = decodeBackend.decode(prepared, candidate.binarizer());
        } catch (RuntimeException e) {
            logger.debug("Decoder threw for '{}' of strategy '{}' [code={}]: reason={}",
                candidate.description(),
                strategy.label(),
                RecoveryFailureCode.DECODE_FAILED.code(),
                resolveFailureReason(e),
                e);
            return Optional.empty();
        }
        if (outcome == null) {
            logger.debug("Decoder returned no outcome for '{}' of strategy '{}' [code={}]",
                candidate.description(), strategy.label(), RecoveryFailureCode.DECODE_FAILED.code());
            return Optional.empty();
        }
        if (outcome.status() == DecodeStatus.ERROR) {
            logger.debug("Decoder reported an error for '{}' of strategy '{}' [code={}]: reason={}",
                candidate.description(),
                strategy.label(),
                RecoveryFailureCode.DECODE_ERROR_REPORTED.code(),
                outcome.reason());
        } else if (!outcome.isSuccess()) {
            logger.trace("'{}' of strategy '{}' with {} binarizer: {}",
                candidate.description(), strategy.label(), candidate.binarizer(), outcome.status());
        }
        return outcome.content();
    }

    private void recordOutcome(String method, long startNanos) {
        recoveryDuration.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        meterRegistry.counter(OUTCOME_METER, "method", method).increment();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String resolveFailureReason(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
