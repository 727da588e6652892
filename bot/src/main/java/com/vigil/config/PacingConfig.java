package com.vigil.config;

import lombok.Data;

/**
 * Human-like pacing, independent of game logic.
 */
@Data
public class PacingConfig {

    private boolean enabled = true;

    private RangeMs thinkDelay = RangeMs.of(400, 2_500);

    private RangeMs nearDeathDwell = RangeMs.of(3_000, 9_000);
    private RangeMs marketDwell = RangeMs.of(1_500, 5_000);
    private RangeMs levelUpDwell = RangeMs.of(2_000, 6_000);
    private double nearDeathHpPct = 0.25;

    private RangeMs shortBreakEvery = RangeMs.of(20 * 60_000, 45 * 60_000);
    private RangeMs shortBreakDuration = RangeMs.of(60_000, 4 * 60_000);

    private RangeMs longBreakEvery = RangeMs.of(2 * 3_600_000L, 4 * 3_600_000L);
    private RangeMs longBreakDuration = RangeMs.of(20 * 60_000, 60 * 60_000);

    /**
     * Upper bound of the deterministic per-identity offset added to break schedules.
     */
    private long identityJitterMaxMs = 30_000;

    /**
     * Rolling one-minute write cap. 0 disables the limiter.
     */
    private int maxWritesPerMinute = 12;

    /**
     * Long sleeps are split into chunks of this size so a stop request is seen quickly.
     */
    private long sleepChunkMs = 1_000;
}
