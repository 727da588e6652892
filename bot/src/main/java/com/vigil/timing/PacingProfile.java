package com.vigil.timing;

import com.vigil.config.PacingConfig;
import com.vigil.config.RangeMs;
import com.vigil.util.Randomization;

/**
 * Samples pacing delays from configured ranges, plus a deterministic per-identity
 * offset so identities started together do not resume in lockstep.
 */
public class PacingProfile {

    private final PacingConfig config;
    private final Randomization randomization;
    private final long identityOffsetMs;

    public PacingProfile(PacingConfig config, Randomization randomization, long adventurerId) {
        this.config = config;
        this.randomization = randomization;
        this.identityOffsetMs = identityOffset(adventurerId, config.getIdentityJitterMaxMs());
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public long getIdentityOffsetMs() {
        return identityOffsetMs;
    }

    public long thinkDelayMs() {
        return sample(config.getThinkDelay());
    }

    public long nearDeathDwellMs() {
        return sample(config.getNearDeathDwell());
    }

    public long marketDwellMs() {
        return sample(config.getMarketDwell());
    }

    public long levelUpDwellMs() {
        return sample(config.getLevelUpDwell());
    }

    /**
     * Time until the next break of this type, including the identity offset.
     */
    public long breakIntervalMs(BreakType type) {
        RangeMs range = type == BreakType.LONG_BREAK ? config.getLongBreakEvery() : config.getShortBreakEvery();
        return sample(range) + identityOffsetMs;
    }

    public long breakDurationMs(BreakType type) {
        RangeMs range = type == BreakType.LONG_BREAK ? config.getLongBreakDuration() : config.getShortBreakDuration();
        return sample(range);
    }

    long sample(RangeMs range) {
        if (range == null) {
            return 0;
        }
        // Gaussian around the midpoint, clamped to the range
        double mean = (range.getMin() + range.getMax()) / 2.0;
        double stdDev = (range.getMax() - range.getMin()) / 4.0;
        if (stdDev <= 0) {
            return range.getMin();
        }
        return randomization.gaussianRandomLong(mean, stdDev, range.getMin(), range.getMax());
    }

    /**
     * SplitMix64 finalizer over the id, reduced to {@code [0, maxMs]}.
     */
    static long identityOffset(long adventurerId, long maxMs) {
        if (maxMs <= 0) {
            return 0;
        }
        long z = adventurerId + 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        z = z ^ (z >>> 31);
        return Math.floorMod(z, maxMs + 1);
    }
}
