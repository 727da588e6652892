package com.vigil.timing;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps writes per rolling minute. A limit of 0 disables it.
 */
public class RollingRateLimiter {

    static final long WINDOW_MS = 60_000;

    private final int maxPerWindow;
    private final Clock clock;
    private final Deque<Long> recent = new ArrayDeque<>();

    public RollingRateLimiter(int maxPerWindow, Clock clock) {
        this.maxPerWindow = maxPerWindow;
        this.clock = clock;
    }

    /**
     * @return milliseconds to wait before the next write is allowed; 0 when allowed now
     */
    public synchronized long delayUntilAllowedMs() {
        if (maxPerWindow <= 0) {
            return 0;
        }
        long now = clock.millis();
        evict(now);
        if (recent.size() < maxPerWindow) {
            return 0;
        }
        return Math.max(0, recent.peekFirst() + WINDOW_MS - now);
    }

    public synchronized void record() {
        long now = clock.millis();
        evict(now);
        recent.addLast(now);
    }

    public synchronized int recentCount() {
        evict(clock.millis());
        return recent.size();
    }

    private void evict(long now) {
        while (!recent.isEmpty() && recent.peekFirst() <= now - WINDOW_MS) {
            recent.removeFirst();
        }
    }
}
