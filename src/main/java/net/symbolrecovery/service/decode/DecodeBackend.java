package net.symbolrecovery.service.decode;

import java.awt.image.BufferedImage;
import net.symbolrecovery.model.decode.BinarizerKind;
import net.symbolrecovery.model.decode.DecodeOutcome;

/**
 * Single-shot symbol decoder consumed by the recovery pipeline.
 *
 * <p>Implementations must be deterministic for a fixed image and binarizer, must not modify
 * the image and must not keep a reference to it after returning. They are shared across
 * threads, so they must be re-entrant.</p>
 */
@FunctionalInterface
public interface DecodeBackend {

    /**
     * Attempts to decode one symbol.
     *
     * @param image image to decode
     * @param binarizer binarization policy to apply before decoding
     * @return a typed outcome; failures are reported as values rather than thrown
     */
    DecodeOutcome decode(BufferedImage image, BinarizerKind binarizer);
}
