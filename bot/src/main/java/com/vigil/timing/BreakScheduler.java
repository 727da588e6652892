package com.vigil.timing;

import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Schedules short breaks and long sleep breaks from the configured intervals.
 *
 * <p>A break that falls due becomes pending. It is handed out only when the
 * adventurer is not in combat, so breaks are deferred, never skipped and never
 * taken mid-fight. A long break also resets the short-break timer.
 */
@Slf4j
public class BreakScheduler {

    @Value
    public static class ScheduledBreak {
        BreakType type;
        Duration duration;
    }

    private final PacingProfile profile;
    private final Clock clock;

    private Instant nextShortBreakTime;
    private Instant nextLongBreakTime;

    @Getter
    @Nullable
    private BreakType pendingBreak;

    @Getter
    private int shortBreaksTaken;

    @Getter
    private int longBreaksTaken;

    public BreakScheduler(PacingProfile profile, Clock clock) {
        this.profile = profile;
        this.clock = clock;
        Instant now = clock.instant();
        scheduleNext(BreakType.SHORT_BREAK, now);
        scheduleNext(BreakType.LONG_BREAK, now);
    }

    /**
     * Mark a break pending when one falls due. Long breaks win over short ones.
     */
    public void tick() {
        if (!profile.isEnabled() || pendingBreak != null) {
            return;
        }
        Instant now = clock.instant();
        if (!now.isBefore(nextLongBreakTime)) {
            pendingBreak = BreakType.LONG_BREAK;
            log.debug("Long break due");
        } else if (!now.isBefore(nextShortBreakTime)) {
            pendingBreak = BreakType.SHORT_BREAK;
            log.debug("Short break due");
        }
    }

    /**
     * Hand out the pending break with a sampled duration, unless in combat.
     */
    public Optional<ScheduledBreak> takeBreak(boolean inCombat) {
        tick();
        if (pendingBreak == null) {
            return Optional.empty();
        }
        if (inCombat) {
            log.debug("Deferring {} until combat ends", pendingBreak.getDisplayName());
            return Optional.empty();
        }
        BreakType type = pendingBreak;
        pendingBreak = null;
        return Optional.of(new ScheduledBreak(type, Duration.ofMillis(profile.breakDurationMs(type))));
    }

    /**
     * Reschedule after a break finished.
     */
    public void onBreakCompleted(BreakType type) {
        Instant now = clock.instant();
        if (type == BreakType.LONG_BREAK) {
            longBreaksTaken++;
            scheduleNext(BreakType.LONG_BREAK, now);
        } else {
            shortBreaksTaken++;
        }
        scheduleNext(BreakType.SHORT_BREAK, now);
        log.debug("{} completed, next short break at {}, next long break at {}",
                type.getDisplayName(), nextShortBreakTime, nextLongBreakTime);
    }

    public Instant getNextBreakTime(BreakType type) {
        return type == BreakType.LONG_BREAK ? nextLongBreakTime : nextShortBreakTime;
    }

    private void scheduleNext(BreakType type, Instant from) {
        Instant next = from.plusMillis(profile.breakIntervalMs(type));
        if (type == BreakType.LONG_BREAK) {
            nextLongBreakTime = next;
        } else {
            nextShortBreakTime = next;
        }
    }
}
