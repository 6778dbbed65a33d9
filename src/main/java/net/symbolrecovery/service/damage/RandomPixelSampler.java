package net.symbolrecovery.service.damage;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

/**
 * Samples a fixed number of uniformly random pixel coordinates.
 *
 * <p>With a seed every call replays the same coordinate sequence, which makes assessments
 * reproducible; without one each call draws from the calling thread's generator.</p>
 */
public final class RandomPixelSampler implements PixelSampler {

    private final int sampleSize;
    private final Long seed;

    public RandomPixelSampler(int sampleSize, Long seed) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive but was " + sampleSize);
        }
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    /** Unseeded sampler. */
    public RandomPixelSampler(int sampleSize) {
        this(sampleSize, null);
    }

    @Override
    public IntStream sampleIndices(int width, int height) {
        RandomGenerator random = seed != null ? new Random(seed) : ThreadLocalRandom.current();
        return IntStream.range(0, sampleSize).map(i -> {
            int x = random.nextInt(width);
            int y = random.nextInt(height);
            return y * width + x;
        });
    }

    public int sampleSize() {
        return sampleSize;
    }
}
