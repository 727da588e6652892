package com.vigil.util;

import javax.inject.Singleton;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Statistical sampling used for pacing: think delays, dwell times and break lengths.
 *
 * <p>The seeded constructor gives reproducible sequences for tests and for the
 * deterministic per-identity jitter.
 */
@Singleton
public class Randomization {

    private final Random random;

    public Randomization() {
        this.random = ThreadLocalRandom.current();
    }

    /**
     * Constructor with seeded random for deterministic sequences.
     *
     * @param seed the random seed
     */
    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    // ========================================================================
    // Gaussian (Normal) Distribution
    // ========================================================================

    /**
     * Generate a random value from a Gaussian (normal) distribution.
     *
     * @param mean   the mean (μ) of the distribution
     * @param stdDev the standard deviation (σ) of the distribution
     * @return a random value from N(mean, stdDev²)
     */
    public double gaussianRandom(double mean, double stdDev) {
        return mean + random.nextGaussian() * stdDev;
    }

    /**
     * Generate a bounded long from a Gaussian distribution.
     *
     * @param mean   the mean in milliseconds
     * @param stdDev the standard deviation in milliseconds
     * @param min    the minimum allowed value
     * @param max    the maximum allowed value
     * @return a random long from N(mean, stdDev²) clamped to [min, max]
     */
    public long gaussianRandomLong(double mean, double stdDev, long min, long max) {
        return Math.round(clamp(gaussianRandom(mean, stdDev), min, max));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
