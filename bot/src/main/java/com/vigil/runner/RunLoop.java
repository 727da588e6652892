package com.vigil.runner;

import com.google.common.collect.ImmutableMap;
import com.vigil.chain.SettlementHandle;
import com.vigil.chain.TransientReadException;
import com.vigil.chain.WriteException;
import com.vigil.config.PacingConfig;
import com.vigil.config.RecoveryConfig;
import com.vigil.config.RunnerConfig;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMetaCache;
import com.vigil.decision.Action;
import com.vigil.decision.ActionType;
import com.vigil.decision.DecisionEngine;
import com.vigil.decision.DecisionOptions;
import com.vigil.observe.EventLevel;
import com.vigil.observe.EventSink;
import com.vigil.observe.Milestones;
import com.vigil.observe.ProgressStore;
import com.vigil.session.GameSession;
import com.vigil.session.SessionBootstrapper;
import com.vigil.state.DerivedState;
import com.vigil.state.RawSnapshot;
import com.vigil.state.StateDeriver;
import com.vigil.timing.BreakScheduler;
import com.vigil.timing.PacingProfile;
import com.vigil.timing.RollingRateLimiter;
import com.vigil.timing.Sleeper;
import com.vigil.timing.StopSignal;
import com.vigil.util.Randomization;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Single-threaded read, decide, write loop for one adventurer identity.
 *
 * <p>Each iteration reads and derives the world state, then checks its guards in
 * priority order:
 * <ol>
 *   <li>a previous write is still settling</li>
 *   <li>the adventurer is dead</li>
 *   <li>the randomness circuit is open</li>
 *   <li>a randomness draw is pending</li>
 *   <li>a break is due</li>
 *   <li>no progress for too long</li>
 * </ol>
 * and only when none applies decides and submits one action.
 *
 * <p>Every failure is caught per iteration and mapped to a recovery; nothing a
 * game contract rejects stops the loop. The stop signal is checked at the top of
 * every iteration and between sleep chunks.
 */
@Slf4j
public class RunLoop {

    private final RunnerConfig config;
    private final SessionBootstrapper bootstrapper;
    private final DecisionEngine engine;
    private final ItemMetaCache itemCache;
    private final EventSink events;
    private final ProgressStore progress;
    private final Clock clock;
    private final Sleeper sleeper;
    private final StopSignal stopSignal;
    private final Randomization randomization;
    private final WriteExecutor writeExecutor;
    private final StateDeriver deriver;
    private final SettlementWaiter settlementWaiter;

    @Getter
    @Nullable
    private GameSession session;

    @Getter
    @Nullable
    private RunnerRuntimeState runtime;

    @Inject
    public RunLoop(RunnerConfig config, SessionBootstrapper bootstrapper, DecisionEngine engine,
                   ItemMetaCache itemCache, EventSink events, ProgressStore progress, Clock clock,
                   Sleeper sleeper, StopSignal stopSignal, Randomization randomization,
                   WriteExecutor writeExecutor) {
        this.config = config;
        this.bootstrapper = bootstrapper;
        this.engine = engine;
        this.itemCache = itemCache;
        this.events = events;
        this.progress = progress;
        this.clock = clock;
        this.sleeper = sleeper;
        this.stopSignal = stopSignal;
        this.randomization = randomization;
        this.writeExecutor = writeExecutor;
        this.deriver = new StateDeriver(config.getPolicy().getHpBase(), config.getPolicy().getHpPerVitality());
        this.settlementWaiter = new SettlementWaiter(config.getRecovery(), deriver, clock, sleeper, stopSignal);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Acquire the session. Failures here are initialization errors.
     */
    public void start() throws IOException {
        session = bootstrapper.bootstrap();
        runtime = newRuntime(session.getAdventurerId());
        events.log(EventLevel.INFO, "session_started", ImmutableMap.of(
                "adventurerId", session.getAdventurerId(),
                "address", String.valueOf(session.getAddress()),
                "signer", config.getChain().getSigner()));
    }

    /**
     * Loop until the stop signal is raised or the thread is interrupted.
     */
    public void run() throws IOException {
        if (session == null) {
            start();
        }
        log.info("Run loop started for adventurer {}", session.getAdventurerId());
        try {
            while (!stopSignal.isStopRequested()) {
                StepOutcome outcome = step();
                long delay = delayAfter(outcome);
                if (delay > 0) {
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Run loop interrupted");
        }
        log.info("Run loop stopped");
        events.log(EventLevel.INFO, "runner_stopped", ImmutableMap.of("adventurerId", runtime.getAdventurerId()));
    }

    /**
     * One iteration.
     */
    public StepOutcome step() throws InterruptedException {
        if (stopSignal.isStopRequested()) {
            return StepOutcome.STOPPED;
        }
        try {
            return guardedStep();
        } catch (RuntimeException e) {
            log.error("Unexpected error in iteration", e);
            return onFailure("iteration", e, 0);
        }
    }

    private StepOutcome guardedStep() throws InterruptedException {
        DerivedState state;
        try {
            state = readState();
        } catch (IOException e) {
            return onFailure("read", e, 0);
        }
        long now = clock.millis();
        observe(state, now);

        PendingSettlement pending = runtime.getPendingSettlement();
        if (pending != null) {
            if (pending.isSatisfiedBy(state)) {
                runtime.setPendingSettlement(null);
            } else {
                long waited = now - pending.getSubmittedAtMillis();
                if (waited < config.getRecovery().getAwaitSettlementTimeoutMs()) {
                    log.debug("Awaiting {} to settle: action count {} < {} ({}ms)",
                            pending.getType(), state.getActionCount(), pending.getExpectedActionCount(), waited);
                    return StepOutcome.AWAITING_SETTLEMENT;
                }
                log.warn("{} still unsettled after {}ms at action count {}, resyncing",
                        pending.getType(), waited, state.getActionCount());
                events.log(EventLevel.WARN, "settlement_wait_expired", ImmutableMap.of(
                        "action", pending.getType().name(),
                        "actionCount", state.getActionCount(),
                        "expectedActionCount", pending.getExpectedActionCount(),
                        "elapsedMs", waited));
                runtime.setPendingSettlement(null);
                runtime.touchProgress(now);
                resync("settlement wait expired");
                return StepOutcome.RESYNCED;
            }
        }

        if (state.isTerminated()) {
            return handleDeath(state, now);
        }

        if (runtime.isRandomnessCircuitOpen(now)) {
            if (now - runtime.getLastCircuitResyncMillis() >= config.getRecovery().getRandomnessResyncIntervalMs()) {
                runtime.setLastCircuitResyncMillis(now);
                resync("randomness circuit open");
            }
            return StepOutcome.RANDOMNESS_CIRCUIT_OPEN;
        }
        if (runtime.closeExpiredCircuit(now)) {
            log.info("Randomness circuit closed at action count {}", state.getActionCount());
            events.log(EventLevel.INFO, "randomness_circuit_closed",
                    ImmutableMap.of("actionCount", state.getActionCount()));
        }

        if (runtime.isBlocked(BlockerKind.RANDOMNESS, state.getActionCount(), now)) {
            return StepOutcome.RANDOMNESS_WAIT;
        }

        Optional<BreakScheduler.ScheduledBreak> due = runtime.getBreaks().takeBreak(state.isInCombat());
        if (due.isPresent()) {
            return takeBreak(due.get(), state);
        }

        long sinceProgress = now - runtime.getLastProgressMillis();
        if (sinceProgress >= config.getRecovery().getStaleProgressMs()) {
            log.warn("No progress for {}ms at action count {}, resyncing", sinceProgress, state.getActionCount());
            events.log(EventLevel.WARN, "stalled", ImmutableMap.of(
                    "actionCount", state.getActionCount(),
                    "elapsedMs", sinceProgress));
            runtime.touchProgress(now);
            resync("stale progress");
            return StepOutcome.STALLED;
        }

        return act(state, now);
    }

    // ========================================================================
    // Read and observe
    // ========================================================================

    private DerivedState readState() throws IOException, InterruptedException {
        long adventurerId = session.getAdventurerId();
        int attempts = config.getChain().getReadAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                RawSnapshot snapshot = session.getReader().getWorldState(adventurerId);
                return deriver.derive(adventurerId, snapshot);
            } catch (TransientReadException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.debug("Read attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                sleeper.sleep(config.getChain().getReadRetryBaseDelayMs() * attempt);
            }
        }
    }

    private void observe(DerivedState state, long now) {
        boolean first = !runtime.isObserved();
        int previousXp = runtime.getLastXp();
        long previousActionCount = runtime.getLastActionCount();
        int previousLevel = runtime.getLastLevel();
        double previousHpPct = runtime.getLastHpPct();
        int previousMaxLevel = runtime.getMaxLevel();
        int targetLevel = config.getPolicy().getTargetLevel();

        boolean progressed = runtime.observe(state.getXp(), state.getActionCount(), state.getLevel(),
                state.getHpPct(), now);
        if (first) {
            runtime.setTargetLevelReported(state.getLevel() >= targetLevel);
            progress.updateBest(state.getAdventurerId(), state.getLevel(), state.getXp(), state.getActionCount());
            return;
        }

        if (state.getXp() > previousXp) {
            events.milestone(Milestones.XP_GAIN, ImmutableMap.of(
                    "xp", state.getXp(),
                    "gained", state.getXp() - previousXp));
        }
        if (state.getActionCount() > previousActionCount) {
            events.milestone(Milestones.ACTION_COUNT, ImmutableMap.of("actionCount", state.getActionCount()));
        }
        if (state.getLevel() > previousLevel) {
            log.info("Level up: {} -> {}", previousLevel, state.getLevel());
            events.milestone(Milestones.LEVEL_UP, ImmutableMap.of("from", previousLevel, "to", state.getLevel()));
            if (runtime.getPacing().isEnabled()) {
                runtime.addDwell(runtime.getPacing().levelUpDwellMs());
            }
            if (state.getLevel() > previousMaxLevel) {
                events.milestone(Milestones.NEW_MAX_LEVEL, ImmutableMap.of("level", state.getLevel()));
            }
            if (state.getLevel() >= targetLevel && !runtime.isTargetLevelReported()) {
                runtime.setTargetLevelReported(true);
                log.info("Target level {} reached by adventurer {}", targetLevel, state.getAdventurerId());
                events.milestone(Milestones.TARGET_LEVEL_REACHED, ImmutableMap.of(
                        "level", state.getLevel(),
                        "targetLevel", targetLevel));
            }
        }
        if (progressed) {
            progress.updateBest(state.getAdventurerId(), state.getLevel(), state.getXp(), state.getActionCount());
        }

        PacingConfig pacing = config.getPacing();
        if (state.getHp() > 0 && state.getHpPct() < pacing.getNearDeathHpPct()
                && previousHpPct >= pacing.getNearDeathHpPct()) {
            events.log(EventLevel.INFO, "near_death", ImmutableMap.of(
                    "hp", state.getHp(),
                    "maxHp", state.getMaxHp(),
                    "actionCount", state.getActionCount()));
            if (runtime.getPacing().isEnabled()) {
                runtime.addDwell(runtime.getPacing().nearDeathDwellMs());
            }
        }
    }

    // ========================================================================
    // Guards
    // ========================================================================

    private StepOutcome handleDeath(DerivedState state, long now) {
        if (runtime.isDeathDebounced(now, config.getRecovery().getDeathCooldownMs())) {
            return StepOutcome.TERMINATED;
        }
        runtime.markDeathHandled(now);

        long adventurerId = state.getAdventurerId();
        log.info("Adventurer {} died at level {} (xp {}, action count {})",
                adventurerId, state.getLevel(), state.getXp(), state.getActionCount());
        events.milestone(Milestones.DEATH, ImmutableMap.of(
                "adventurerId", adventurerId,
                "level", state.getLevel(),
                "xp", state.getXp(),
                "actionCount", state.getActionCount()));
        progress.appendRun(new ProgressStore.RunRecord(
                adventurerId,
                Instant.ofEpochMilli(runtime.getStartedAtMillis()),
                clock.instant(),
                now - runtime.getStartedAtMillis(),
                state.getLevel(),
                state.getXp(),
                state.getActionCount(),
                Math.max(runtime.getMaxLevel(), state.getLevel()),
                Math.max(runtime.getMaxXp(), state.getXp())));

        if (!config.getSession().isAutoRotateOnDeath()) {
            log.warn("Auto rotation disabled, stopping after death of adventurer {}", adventurerId);
            stopSignal.requestStop();
            return StepOutcome.TERMINATED;
        }

        try {
            GameSession next = bootstrapper.rotate(adventurerId);
            session = next;
            runtime = newRuntime(next.getAdventurerId());
            log.info("Rotated identity: adventurer {} -> {}", adventurerId, next.getAdventurerId());
            events.milestone(Milestones.IDENTITY_ROTATED, ImmutableMap.of(
                    "previousAdventurerId", adventurerId,
                    "adventurerId", next.getAdventurerId()));
        } catch (IOException e) {
            log.error("Identity rotation after death of adventurer {} failed, retrying after {}ms",
                    adventurerId, config.getRecovery().getDeathCooldownMs(), e);
            events.log(EventLevel.ERROR, "rotation_failed", ImmutableMap.of(
                    "adventurerId", adventurerId,
                    "error", String.valueOf(e.getMessage())));
        }
        return StepOutcome.TERMINATED;
    }

    private StepOutcome takeBreak(BreakScheduler.ScheduledBreak due, DerivedState state) throws InterruptedException {
        long durationMs = due.getDuration().toMillis();
        log.info("Taking {} for {}s at action count {}",
                due.getType().getDisplayName(), durationMs / 1000, state.getActionCount());
        events.log(EventLevel.INFO, "break", ImmutableMap.of(
                "type", due.getType().name(),
                "durationMs", durationMs,
                "actionCount", state.getActionCount()));
        sleeper.sleep(durationMs);
        runtime.getBreaks().onBreakCompleted(due.getType());
        runtime.touchProgress(clock.millis());
        return StepOutcome.ON_BREAK;
    }

    // ========================================================================
    // Decide and act
    // ========================================================================

    private StepOutcome act(DerivedState state, long now) throws InterruptedException {
        boolean gearBlocked = runtime.isBlocked(BlockerKind.GEAR, state.getActionCount(), now);
        DecisionOptions options = DecisionOptions.builder()
                .considerEquip(!gearBlocked)
                .allowGearPurchase(!gearBlocked)
                .allowMarket(!runtime.isBlocked(BlockerKind.MARKET, state.getActionCount(), now))
                .allowStatSelection(!runtime.isBlocked(BlockerKind.STATS, state.getActionCount(), now))
                .build();
        ItemCatalog catalog = itemCache.catalogFor(session.getReader(), state.referencedItemIds());
        Action action = engine.decide(state, config.getPolicy(), catalog, options);
        if (!action.getType().isWrite()) {
            log.debug("Waiting: {}", action.getReason());
            return StepOutcome.WAITED;
        }

        pace();
        if (stopSignal.isStopRequested()) {
            return StepOutcome.STOPPED;
        }
        return execute(action, state);
    }

    private void pace() throws InterruptedException {
        long delay = runtime.consumeDwell();
        if (runtime.getPacing().isEnabled()) {
            delay += runtime.getPacing().thinkDelayMs();
        }
        if (delay > 0) {
            sleeper.sleep(delay);
        }
        long rateDelay = runtime.getRateLimiter().delayUntilAllowedMs();
        if (rateDelay > 0) {
            log.debug("Write rate limit reached ({} in the last minute), waiting {}ms",
                    runtime.getRateLimiter().recentCount(), rateDelay);
            sleeper.sleep(rateDelay);
        }
    }

    private StepOutcome execute(Action action, DerivedState state) throws InterruptedException {
        RecoveryConfig recovery = config.getRecovery();
        log.info("{} at action count {}: {}", action.getType(), state.getActionCount(), action.getReason());
        events.log(EventLevel.INFO, "action", ImmutableMap.of(
                "type", action.getType().name(),
                "reason", action.getReason(),
                "actionCount", state.getActionCount(),
                "hp", state.getHp(),
                "level", state.getLevel()));

        long submittedAt = clock.millis();
        GameSession current = session;
        WriteOutcome outcome = writeExecutor.submit(
                () -> ActionDispatcher.dispatch(action, state, current.getWriter()), recovery.getWriteTimeoutMs());
        runtime.getRateLimiter().record();

        switch (outcome.getStatus()) {
            case TIMED_OUT:
                runtime.setPendingSettlement(new PendingSettlement(
                        state.getActionCount() + 1, submittedAt, null, action.getType()));
                events.log(EventLevel.WARN, "write_unconfirmed", ImmutableMap.of(
                        "type", action.getType().name(),
                        "actionCount", state.getActionCount(),
                        "elapsedMs", outcome.getElapsedMs()));
                resync("write timed out");
                return StepOutcome.WRITE_UNCONFIRMED;
            case FAILED:
                return onWriteError(action, state, outcome.getError(), outcome.getElapsedMs());
            default:
                return awaitSettlement(action, state, outcome.getHandle(), submittedAt);
        }
    }

    private StepOutcome awaitSettlement(Action action, DerivedState state, SettlementHandle handle,
                                        long submittedAt) throws InterruptedException {
        runtime.resetFailures();
        runtime.clearBlocker(BlockerKind.RANDOMNESS);

        PendingSettlement pending = new PendingSettlement(
                state.getActionCount() + 1, submittedAt, handle.getTxHash(), action.getType());
        runtime.setPendingSettlement(pending);

        SettlementResult result = settlementWaiter.await(session.getReader(), state.getAdventurerId(), pending);
        switch (result) {
            case CONFIRMED:
                // the pending guard clears it once a read shows the action count advanced
                if (action.getType().isMarketAction() && runtime.getPacing().isEnabled()) {
                    runtime.addDwell(runtime.getPacing().marketDwellMs());
                }
                return StepOutcome.ACTED;
            case REVERTED:
                runtime.setPendingSettlement(null);
                events.log(EventLevel.WARN, "write_reverted", ImmutableMap.of(
                        "type", action.getType().name(),
                        "actionCount", state.getActionCount(),
                        "txHash", String.valueOf(handle.getTxHash())));
                return onFailure(action.getType().name() + " settlement", null, clock.millis() - submittedAt);
            case TIMED_OUT:
                events.log(EventLevel.WARN, "settlement_timeout", ImmutableMap.of(
                        "type", action.getType().name(),
                        "actionCount", state.getActionCount(),
                        "elapsedMs", clock.millis() - submittedAt));
                return StepOutcome.ACTED;
            default:
                return StepOutcome.STOPPED;
        }
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    private StepOutcome onWriteError(Action action, DerivedState state, WriteException error, long elapsedMs) {
        RecoveryConfig recovery = config.getRecovery();
        long actionCount = state.getActionCount();
        long now = clock.millis();

        switch (error.getKind()) {
            case RANDOMNESS_PENDING: {
                int attempt = runtime.attemptsAt(BlockerKind.RANDOMNESS, actionCount) + 1;
                long delay = RandomnessBackoff.delayMs(attempt,
                        recovery.getRandomnessBaseDelayMs(), recovery.getRandomnessMaxDelayMs());
                runtime.block(BlockerKind.RANDOMNESS, actionCount, now, delay);
                int recent = runtime.recordRandomnessFailure(now, recovery.getRandomnessCircuitWindowMs());
                log.info("Randomness not ready for {} at action count {} (attempt {}, {} in window, {}ms), retrying in {}ms",
                        action.getType(), actionCount, attempt, recent, elapsedMs, delay);
                events.log(EventLevel.INFO, "randomness_wait", ImmutableMap.of(
                        "type", action.getType().name(),
                        "actionCount", actionCount,
                        "attempt", attempt,
                        "delayMs", delay));
                if (recent >= recovery.getRandomnessCircuitAttempts()) {
                    runtime.openRandomnessCircuit(now + recovery.getRandomnessCircuitOpenMs());
                    runtime.setLastCircuitResyncMillis(now);
                    log.warn("Randomness circuit open for {}ms after {} failures", recovery.getRandomnessCircuitOpenMs(), recent);
                    events.log(EventLevel.WARN, "randomness_circuit_open", ImmutableMap.of(
                            "actionCount", actionCount,
                            "failures", recent,
                            "openMs", recovery.getRandomnessCircuitOpenMs()));
                    return StepOutcome.RANDOMNESS_CIRCUIT_OPEN;
                }
                return StepOutcome.RANDOMNESS_WAIT;
            }
            case MARKET_CLOSED:
                return block(BlockerKind.MARKET, action, actionCount, now, recovery.getMarketClosedCooldownMs(), error);
            case STATS_BLOCKED:
                return block(BlockerKind.STATS, action, actionCount, now, recovery.getStatsBlockedCooldownMs(), error);
            case NOT_IN_BATTLE:
            case DEAD_ADVENTURER:
                log.info("{} rejected at action count {} ({}), resyncing: {}",
                        action.getType(), actionCount, error.getKind(), error.getMessage());
                resync(error.getKind().name().toLowerCase(Locale.ROOT));
                return StepOutcome.RESYNCED;
            default:
                if (action.getType() == ActionType.EQUIP || action.getType() == ActionType.BUY_ITEMS) {
                    block(BlockerKind.GEAR, action, actionCount, now, recovery.getGearRejectedCooldownMs(), error);
                }
                return onFailure(action.getType().name(), error, elapsedMs);
        }
    }

    private StepOutcome block(BlockerKind kind, Action action, long actionCount, long now, long cooldownMs,
                              WriteException error) {
        Blocker blocker = runtime.block(kind, actionCount, now, cooldownMs);
        log.info("{} blocked at action count {} for up to {}ms (attempt {}): {}",
                kind, actionCount, cooldownMs, blocker.getAttempts(), error.getMessage());
        events.log(EventLevel.INFO, "blocked", ImmutableMap.of(
                "blocker", kind.name(),
                "type", action.getType().name(),
                "actionCount", actionCount,
                "attempt", blocker.getAttempts()));
        return StepOutcome.BLOCKED;
    }

    private StepOutcome onFailure(String context, @Nullable Exception error, long elapsedMs) {
        int failures = runtime.recordFailure();
        int budget = config.getRecovery().getMaxConsecutiveFailures();
        String message = error == null ? "reverted" : String.valueOf(error.getMessage());
        log.warn("{} failed at action count {} (failure {}/{}, {}ms): {}",
                context, runtime.getLastActionCount(), failures, budget, elapsedMs, message);
        events.log(EventLevel.WARN, "failure", ImmutableMap.of(
                "context", context,
                "actionCount", runtime.getLastActionCount(),
                "attempt", failures,
                "elapsedMs", elapsedMs,
                "error", message));
        if (failures >= budget) {
            return rebootstrap(failures);
        }
        return StepOutcome.FAILED;
    }

    private StepOutcome rebootstrap(int failures) {
        log.warn("Rebootstrapping after {} consecutive failures", failures);
        events.log(EventLevel.WARN, "rebootstrap", ImmutableMap.of(
                "adventurerId", runtime.getAdventurerId(),
                "failures", failures));
        try {
            session = bootstrapper.bootstrap();
            runtime = newRuntime(session.getAdventurerId());
            return StepOutcome.REBOOTSTRAPPED;
        } catch (IOException e) {
            log.error("Rebootstrap failed", e);
            runtime.resetFailures();
            return StepOutcome.FAILED;
        }
    }

    private void resync(String reason) {
        log.info("Resyncing execution layer: {}", reason);
        events.log(EventLevel.INFO, "resync", ImmutableMap.of(
                "reason", reason,
                "actionCount", runtime.getLastActionCount()));
        session.getWriter().resync();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * How long to sleep before the next iteration.
     */
    long delayAfter(StepOutcome outcome) {
        RecoveryConfig recovery = config.getRecovery();
        long now = clock.millis();
        switch (outcome) {
            case STOPPED:
            case ACTED:
            case ON_BREAK:
                return 0;
            case AWAITING_SETTLEMENT:
                return recovery.getSettlementPollIntervalMs();
            case RANDOMNESS_WAIT: {
                Blocker blocker = runtime.getBlocker(BlockerKind.RANDOMNESS);
                return blocker == null ? recovery.getIdlePollMs() : Math.max(1, blocker.remainingMillis(now));
            }
            case RANDOMNESS_CIRCUIT_OPEN: {
                long untilOpenEnds = runtime.getRandomnessCircuitOpenUntilMillis() - now;
                return Math.max(recovery.getIdlePollMs(),
                        Math.min(recovery.getRandomnessResyncIntervalMs(), untilOpenEnds));
            }
            case FAILED:
                return recovery.getFailureBackoffMs() * Math.max(1, runtime.getConsecutiveFailures());
            case REBOOTSTRAPPED:
                return recovery.getFailureBackoffMs();
            default:
                return recovery.getIdlePollMs();
        }
    }

    private RunnerRuntimeState newRuntime(long adventurerId) {
        PacingProfile pacing = new PacingProfile(config.getPacing(), randomization, adventurerId);
        return new RunnerRuntimeState(adventurerId, clock.millis(), pacing,
                new BreakScheduler(pacing, clock),
                new RollingRateLimiter(config.getPacing().getMaxWritesPerMinute(), clock));
    }
}
