package net.symbolrecovery.service.damage;

import java.util.stream.IntStream;

/**
 * Chooses which pixels the contrast estimate looks at.
 *
 * <p>Implementations are swapped in to trade the cheap random probe for a reproducible one.</p>
 */
@FunctionalInterface
public interface PixelSampler {

    /**
     * Row-major pixel indices ({@code y * width + x}) to sample. Indices may repeat.
     *
     * @param width image width, positive
     * @param height image height, positive
     * @return a finite stream of indices in {@code [0, width * height)}
     */
    IntStream sampleIndices(int width, int height);
}
