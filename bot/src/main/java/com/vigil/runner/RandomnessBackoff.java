package com.vigil.runner;

/**
 * Delay before retrying after the n-th consecutive randomness-pending failure at
 * one action count: base delay doubling per attempt, capped.
 */
public final class RandomnessBackoff {

    private RandomnessBackoff() {
    }

    public static long delayMs(int attempt, long baseDelayMs, long maxDelayMs) {
        if (attempt <= 1) {
            return Math.min(baseDelayMs, maxDelayMs);
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = baseDelayMs << shift;
        if (delay <= 0 || delay / (1L << shift) != baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(delay, maxDelayMs);
    }
}
