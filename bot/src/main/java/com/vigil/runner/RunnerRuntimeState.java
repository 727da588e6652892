package com.vigil.runner;

import com.vigil.timing.BreakScheduler;
import com.vigil.timing.PacingProfile;
import com.vigil.timing.RollingRateLimiter;
import lombok.Getter;
import lombok.Setter;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything the run loop remembers between iterations for one identity:
 * blockers, the pending settlement, progress bookkeeping, the randomness circuit,
 * pacing timers and the write rate window.
 *
 * <p>Owned by exactly one loop and never shared. A new instance replaces it
 * whenever the identity changes or the loop rebootstraps.
 */
public class RunnerRuntimeState {

    @Getter
    private final long adventurerId;

    @Getter
    private final long startedAtMillis;

    @Getter
    private final PacingProfile pacing;

    @Getter
    private final BreakScheduler breaks;

    @Getter
    private final RollingRateLimiter rateLimiter;

    private final Map<BlockerKind, Blocker> blockers = new EnumMap<>(BlockerKind.class);

    @Getter
    @Setter
    @Nullable
    private PendingSettlement pendingSettlement;

    // ========================================================================
    // Progress
    // ========================================================================

    @Getter
    private long lastProgressMillis;

    @Getter
    private boolean observed;

    @Getter
    private int lastXp;

    @Getter
    private long lastActionCount;

    @Getter
    private int lastLevel;

    @Getter
    private double lastHpPct = 1.0;

    @Getter
    private int maxLevel;

    @Getter
    private int maxXp;

    @Getter
    @Setter
    private boolean targetLevelReported;

    /**
     * Post-event dwell to apply before the next write.
     */
    private long pendingDwellMs;

    // ========================================================================
    // Failures
    // ========================================================================

    @Getter
    private int consecutiveFailures;

    private final Deque<Long> randomnessFailures = new ArrayDeque<>();

    @Getter
    private long randomnessCircuitOpenUntilMillis;

    @Getter
    @Setter
    private long lastCircuitResyncMillis;

    @Getter
    private long deathHandledAtMillis = -1;

    public RunnerRuntimeState(long adventurerId, long nowMillis, PacingProfile pacing,
                              BreakScheduler breaks, RollingRateLimiter rateLimiter) {
        this.adventurerId = adventurerId;
        this.startedAtMillis = nowMillis;
        this.lastProgressMillis = nowMillis;
        this.pacing = pacing;
        this.breaks = breaks;
        this.rateLimiter = rateLimiter;
    }

    // ========================================================================
    // Blockers
    // ========================================================================

    /**
     * Block {@code kind} for the rest of this action count and at most {@code durationMs}.
     * Attempts accumulate while the action count stays the same.
     *
     * @return the recorded blocker
     */
    public Blocker block(BlockerKind kind, long actionCount, long nowMillis, long durationMs) {
        Blocker previous = blockers.get(kind);
        int attempts = previous != null && previous.getBlockedUntilActionCount() == actionCount + 1
                ? previous.getAttempts() + 1
                : 1;
        Blocker blocker = new Blocker(actionCount + 1, nowMillis + durationMs, attempts);
        blockers.put(kind, blocker);
        return blocker;
    }

    /**
     * Consecutive attempts recorded for {@code kind} at this action count, 0 if none.
     */
    public int attemptsAt(BlockerKind kind, long actionCount) {
        Blocker blocker = blockers.get(kind);
        return blocker != null && blocker.getBlockedUntilActionCount() == actionCount + 1 ? blocker.getAttempts() : 0;
    }

    public boolean isBlocked(BlockerKind kind, long actionCount, long nowMillis) {
        Blocker blocker = blockers.get(kind);
        return blocker != null && blocker.isActive(actionCount, nowMillis);
    }

    @Nullable
    public Blocker getBlocker(BlockerKind kind) {
        return blockers.get(kind);
    }

    public void clearBlocker(BlockerKind kind) {
        blockers.remove(kind);
    }

    // ========================================================================
    // Progress
    // ========================================================================

    /**
     * Record the latest observation.
     *
     * @return true when xp or the action count increased
     */
    public boolean observe(int xp, long actionCount, int level, double hpPct, long nowMillis) {
        boolean progressed = !observed || xp > lastXp || actionCount > lastActionCount;
        if (progressed) {
            lastProgressMillis = nowMillis;
        }
        observed = true;
        lastXp = xp;
        lastActionCount = actionCount;
        lastLevel = level;
        lastHpPct = hpPct;
        maxLevel = Math.max(maxLevel, level);
        maxXp = Math.max(maxXp, xp);
        return progressed;
    }

    /**
     * Restart the stale-progress clock after a recovery.
     */
    public void touchProgress(long nowMillis) {
        lastProgressMillis = nowMillis;
    }

    public void addDwell(long millis) {
        pendingDwellMs = Math.max(pendingDwellMs, millis);
    }

    public long consumeDwell() {
        long dwell = pendingDwellMs;
        pendingDwellMs = 0;
        return dwell;
    }

    // ========================================================================
    // Failures
    // ========================================================================

    public int recordFailure() {
        return ++consecutiveFailures;
    }

    public void resetFailures() {
        consecutiveFailures = 0;
    }

    /**
     * Record a randomness-pending failure in the circuit window.
     *
     * @return failures within the window, including this one
     */
    public int recordRandomnessFailure(long nowMillis, long windowMs) {
        randomnessFailures.addLast(nowMillis);
        while (!randomnessFailures.isEmpty() && randomnessFailures.peekFirst() <= nowMillis - windowMs) {
            randomnessFailures.removeFirst();
        }
        return randomnessFailures.size();
    }

    public void openRandomnessCircuit(long untilMillis) {
        randomnessCircuitOpenUntilMillis = untilMillis;
        randomnessFailures.clear();
    }

    public boolean isRandomnessCircuitOpen(long nowMillis) {
        return nowMillis < randomnessCircuitOpenUntilMillis;
    }

    /**
     * True once after an open circuit has expired.
     */
    public boolean closeExpiredCircuit(long nowMillis) {
        if (randomnessCircuitOpenUntilMillis > 0 && nowMillis >= randomnessCircuitOpenUntilMillis) {
            randomnessCircuitOpenUntilMillis = 0;
            return true;
        }
        return false;
    }

    // ========================================================================
    // Death
    // ========================================================================

    public boolean isDeathDebounced(long nowMillis, long cooldownMs) {
        return deathHandledAtMillis >= 0 && nowMillis - deathHandledAtMillis < cooldownMs;
    }

    public void markDeathHandled(long nowMillis) {
        deathHandledAtMillis = nowMillis;
    }
}
