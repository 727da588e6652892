package com.vigil.runner;

import lombok.Value;

/**
 * Active while the adventurer is still below {@code blockedUntilActionCount} and
 * the clock is before {@code blockedUntilMillis}. Either one moving past its bound
 * lifts the block.
 */
@Value
public class Blocker {

    long blockedUntilActionCount;

    long blockedUntilMillis;

    /**
     * Consecutive occurrences at the same action count.
     */
    int attempts;

    public boolean isActive(long actionCount, long nowMillis) {
        return actionCount < blockedUntilActionCount && nowMillis < blockedUntilMillis;
    }

    public long remainingMillis(long nowMillis) {
        return Math.max(0, blockedUntilMillis - nowMillis);
    }
}
