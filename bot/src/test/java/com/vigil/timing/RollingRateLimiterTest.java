package com.vigil.timing;

import com.vigil.testutil.ManualClock;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class RollingRateLimiterTest {

    private ManualClock clock;

    @Before
    public void setUp() {
        clock = new ManualClock();
    }

    @Test
    public void testDelay_AllowsUpToLimit() {
        RollingRateLimiter limiter = new RollingRateLimiter(2, clock);

        assertEquals(0, limiter.delayUntilAllowedMs());
        limiter.record();
        clock.advanceMillis(10_000);
        assertEquals(0, limiter.delayUntilAllowedMs());
        limiter.record();

        assertEquals(50_000, limiter.delayUntilAllowedMs());
        assertEquals(2, limiter.recentCount());
    }

    @Test
    public void testDelay_OldWritesLeaveWindow() {
        RollingRateLimiter limiter = new RollingRateLimiter(1, clock);
        limiter.record();

        clock.advanceMillis(RollingRateLimiter.WINDOW_MS);

        assertEquals(0, limiter.delayUntilAllowedMs());
        assertEquals(0, limiter.recentCount());
    }

    @Test
    public void testDelay_ZeroLimitDisables() {
        RollingRateLimiter limiter = new RollingRateLimiter(0, clock);
        for (int i = 0; i < 100; i++) {
            limiter.record();
        }

        assertEquals(0, limiter.delayUntilAllowedMs());
    }
}
