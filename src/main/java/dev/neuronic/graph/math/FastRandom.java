package dev.neuronic.graph.math;

import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Seedable random source for weight initialization and noise layers, backed by Xoroshiro128++.
 *
 * <p>Instances are not thread-safe; layers create one per build or per call from their seed so
 * that results are reproducible.
 */
public final class FastRandom {

    private static final String ALGORITHM = "Xoroshiro128PlusPlus";

    private final RandomGenerator generator;
    private final Long seed;

    /**
     * Unseeded generator, different on every construction.
     */
    public FastRandom() {
        this.generator = RandomGeneratorFactory.of(ALGORITHM).create();
        this.seed = null;
    }

    public FastRandom(long seed) {
        this.generator = RandomGeneratorFactory.of(ALGORITHM).create(seed);
        this.seed = seed;
    }

    /**
     * Generator for one call of a seeded layer. The same {@code (seed, stream)} pair always
     * yields the same sequence.
     */
    public static FastRandom forCall(Long seed, long stream) {
        if (seed == null)
            return new FastRandom();
        return new FastRandom(seed * 0x9E3779B97F4A7C15L + stream);
    }

    public Long getSeed() {
        return seed;
    }

    public float nextFloat() {
        return generator.nextFloat();
    }

    public double nextGaussian() {
        return generator.nextGaussian();
    }

    /**
     * Fill buffer with uniform floats in [min, max).
     */
    public void fillUniform(float[] buffer, float min, float max) {
        float range = max - min;
        for (int i = 0; i < buffer.length; i++)
            buffer[i] = min + generator.nextFloat() * range;
    }

    /**
     * Fill buffer with normally distributed floats.
     */
    public void fillGaussian(float[] buffer, float mean, float stddev) {
        for (int i = 0; i < buffer.length; i++)
            buffer[i] = (float) (mean + generator.nextGaussian() * stddev);
    }
}
