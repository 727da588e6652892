package com.vigil.runner;

import com.vigil.chain.GameReader;
import com.vigil.chain.GameWriter;
import com.vigil.chain.RandomnessSalt;
import com.vigil.chain.SettlementHandle;
import com.vigil.chain.TransientReadException;
import com.vigil.chain.TxStatus;
import com.vigil.chain.WriteErrorKind;
import com.vigil.chain.WriteException;
import com.vigil.config.PolicyConfig;
import com.vigil.config.RangeMs;
import com.vigil.config.RunnerConfig;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMetaCache;
import com.vigil.decision.Action;
import com.vigil.decision.ActionType;
import com.vigil.decision.DecisionEngine;
import com.vigil.decision.DecisionOptions;
import com.vigil.decision.EquipOrder;
import com.vigil.decision.ExplorePayload;
import com.vigil.decision.PotionPurchase;
import com.vigil.observe.EventLevel;
import com.vigil.observe.EventSink;
import com.vigil.observe.Milestones;
import com.vigil.observe.ProgressStore;
import com.vigil.session.GameSession;
import com.vigil.session.SessionBootstrapper;
import com.vigil.state.DerivedState;
import com.vigil.testutil.ManualClock;
import com.vigil.testutil.RecordingSleeper;
import com.vigil.testutil.Snapshots;
import com.vigil.timing.StopSignal;
import com.vigil.util.Randomization;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class RunLoopTest {

    private static final long ADVENTURER = 42L;

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    @Mock
    private SessionBootstrapper bootstrapper;

    @Mock
    private GameReader reader;

    @Mock
    private GameWriter writer;

    @Mock
    private EventSink events;

    private AutoCloseable mocks;
    private RunnerConfig config;
    private ManualClock clock;
    private RecordingSleeper sleeper;
    private StopSignal stopSignal;
    private ProgressStore progress;
    private WriteExecutor writeExecutor;
    private CountDownLatch release;

    @Before
    public void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);

        config = new RunnerConfig();
        config.getPacing().setEnabled(false);
        config.getRecovery().setSettlementTimeoutMs(5_000);

        clock = new ManualClock();
        sleeper = new RecordingSleeper(clock);
        stopSignal = new StopSignal();
        progress = new ProgressStore(temp.getRoot().toPath(), config.getPolicy().getTargetLevel(), clock);
        writeExecutor = new WriteExecutor(clock);
        release = new CountDownLatch(1);

        when(bootstrapper.bootstrap()).thenReturn(new GameSession(ADVENTURER, "0xabc", reader, writer));
    }

    @After
    public void tearDown() throws Exception {
        release.countDown();
        writeExecutor.close();
        mocks.close();
    }

    private RunLoop loop(DecisionEngine engine) throws IOException {
        RunLoop loop = new RunLoop(config, bootstrapper, engine, new ItemMetaCache(), events, progress, clock,
                sleeper, stopSignal, new Randomization(12345L), writeExecutor);
        loop.start();
        return loop;
    }

    private RunLoop loop() throws IOException {
        return loop(new DecisionEngine());
    }

    private SettlementHandle unreported() {
        return new SettlementHandle(null, clock.instant());
    }

    // ========================================================================
    // Acting
    // ========================================================================

    @Test
    public void testStep_ExploresAndWaitsForActionCount() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3), Snapshots.exploring(0, 4));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenReturn(unreported());
        RunLoop loop = loop();

        assertEquals(StepOutcome.ACTED, loop.step());

        verify(writer).explore(eq(ADVENTURER), eq(true), eq(RandomnessSalt.explore(0, ADVENTURER)));
        assertEquals(4, loop.getRuntime().getPendingSettlement().getExpectedActionCount());
        assertEquals(0, loop.getRuntime().getConsecutiveFailures());
    }

    @Test
    public void testStep_StopRequested() throws Exception {
        RunLoop loop = loop();
        stopSignal.requestStop();

        assertEquals(StepOutcome.STOPPED, loop.step());
        verifyNoInteractions(reader, writer);
    }

    @Test
    public void testStep_TransientReadIsRetried() throws Exception {
        when(reader.getWorldState(ADVENTURER))
                .thenThrow(new TransientReadException("reset"))
                .thenReturn(Snapshots.exploring(0, 3), Snapshots.exploring(0, 4));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenReturn(unreported());
        RunLoop loop = loop();

        assertEquals(StepOutcome.ACTED, loop.step());
        assertEquals(Long.valueOf(config.getChain().getReadRetryBaseDelayMs()), sleeper.getSleeps().get(0));
    }

    // ========================================================================
    // Settlement
    // ========================================================================

    @Test
    public void testPendingSettlementTakesPrecedenceOverStaleProgress() throws Exception {
        config.getRecovery().setStaleProgressMs(60_000);
        config.getRecovery().setAwaitSettlementTimeoutMs(180_000);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenReturn(unreported());
        RunLoop loop = loop();

        assertEquals(StepOutcome.ACTED, loop.step());
        assertNotNull(loop.getRuntime().getPendingSettlement());

        clock.advance(Duration.ofSeconds(120));
        assertEquals(StepOutcome.AWAITING_SETTLEMENT, loop.step());
        verify(writer, never()).resync();

        clock.advance(Duration.ofSeconds(60));
        assertEquals(StepOutcome.RESYNCED, loop.step());
        verify(writer).resync();
        assertNull(loop.getRuntime().getPendingSettlement());
        verify(writer, times(1)).explore(anyLong(), anyBoolean(), any());
    }

    @Test
    public void testStep_SucceededReceiptWaitsForActionCountToAdvance() throws Exception {
        when(reader.getWorldState(ADVENTURER))
                .thenReturn(Snapshots.exploring(0, 3), Snapshots.exploring(0, 3), Snapshots.exploring(0, 4));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenReturn(new SettlementHandle("0x1", clock.instant()), new SettlementHandle("0x2", clock.instant()));
        when(reader.getTransactionStatus(anyString())).thenReturn(TxStatus.SUCCEEDED);
        RunLoop loop = loop();

        assertEquals(StepOutcome.ACTED, loop.step());
        assertEquals(4, loop.getRuntime().getPendingSettlement().getExpectedActionCount());

        assertEquals(StepOutcome.AWAITING_SETTLEMENT, loop.step());
        verify(writer, times(1)).explore(anyLong(), anyBoolean(), any());

        assertEquals(StepOutcome.ACTED, loop.step());
        verify(writer, times(2)).explore(anyLong(), anyBoolean(), any());
        assertEquals(5, loop.getRuntime().getPendingSettlement().getExpectedActionCount());
    }

    @Test
    public void testStep_RevertedReceiptCountsAsFailure() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenReturn(new SettlementHandle("0xabc", clock.instant()));
        when(reader.getTransactionStatus("0xabc")).thenReturn(TxStatus.REVERTED);
        RunLoop loop = loop();

        assertEquals(StepOutcome.FAILED, loop.step());
        assertNull(loop.getRuntime().getPendingSettlement());
        assertEquals(1, loop.getRuntime().getConsecutiveFailures());
    }

    @Test
    public void testStep_WriteTimeoutLeavesSettlementPending() throws Exception {
        config.getRecovery().setWriteTimeoutMs(50);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenAnswer(invocation -> {
            release.await();
            return unreported();
        });
        RunLoop loop = loop();

        assertEquals(StepOutcome.WRITE_UNCONFIRMED, loop.step());
        verify(writer).resync();
        assertEquals(4, loop.getRuntime().getPendingSettlement().getExpectedActionCount());

        assertEquals(StepOutcome.AWAITING_SETTLEMENT, loop.step());
    }

    // ========================================================================
    // Write errors
    // ========================================================================

    @Test
    public void testRandomnessPending_BlocksUntilBackoffElapses() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenThrow(new WriteException(WriteErrorKind.RANDOMNESS_PENDING, "VRF request not fulfilled"));
        RunLoop loop = loop();
        long backoff = config.getRecovery().getRandomnessBaseDelayMs();

        assertEquals(StepOutcome.RANDOMNESS_WAIT, loop.step());
        assertEquals(backoff, loop.delayAfter(StepOutcome.RANDOMNESS_WAIT));

        assertEquals(StepOutcome.RANDOMNESS_WAIT, loop.step());
        verify(writer, times(1)).explore(anyLong(), anyBoolean(), any());

        clock.advanceMillis(backoff);
        assertEquals(StepOutcome.RANDOMNESS_WAIT, loop.step());
        verify(writer, times(2)).explore(anyLong(), anyBoolean(), any());
        assertEquals(backoff * 2, loop.delayAfter(StepOutcome.RANDOMNESS_WAIT));
        assertEquals(0, loop.getRuntime().getConsecutiveFailures());
    }

    @Test
    public void testMarketClosed_NextDecisionSkipsMarket() throws Exception {
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class)))
                .thenReturn(Action.of(ActionType.BUY_POTIONS, "low health", new PotionPurchase(2, 4)));
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(9, 3));
        when(writer.buyPotions(anyLong(), anyInt()))
                .thenThrow(new WriteException(WriteErrorKind.MARKET_CLOSED, "Market is closed"));
        RunLoop loop = loop(engine);

        assertEquals(StepOutcome.BLOCKED, loop.step());
        loop.step();

        ArgumentCaptor<DecisionOptions> options = ArgumentCaptor.forClass(DecisionOptions.class);
        verify(engine, times(2)).decide(any(), any(), any(), options.capture());
        List<DecisionOptions> seen = options.getAllValues();
        assertTrue(seen.get(0).isAllowMarket());
        assertFalse(seen.get(1).isAllowMarket());
        assertTrue(seen.get(1).isAllowStatSelection());
    }

    @Test
    public void testRejectedEquip_BlocksGearUntilActionCountAdvances() throws Exception {
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class)))
                .thenReturn(Action.of(ActionType.EQUIP, "upgrade head", new EquipOrder(Collections.singletonList(7))),
                        Action.waitFor("nothing to do"));
        when(reader.getWorldState(ADVENTURER))
                .thenReturn(Snapshots.exploring(0, 3), Snapshots.exploring(0, 3), Snapshots.exploring(0, 4));
        when(writer.equip(anyLong(), anyList(), any()))
                .thenThrow(new WriteException(WriteErrorKind.UNCLASSIFIED, "Item not in bag"));
        RunLoop loop = loop(engine);

        assertEquals(StepOutcome.FAILED, loop.step());
        assertEquals(1, loop.getRuntime().getConsecutiveFailures());
        assertEquals(StepOutcome.WAITED, loop.step());
        assertEquals(StepOutcome.WAITED, loop.step());

        ArgumentCaptor<DecisionOptions> options = ArgumentCaptor.forClass(DecisionOptions.class);
        verify(engine, times(3)).decide(any(), any(), any(), options.capture());
        List<DecisionOptions> seen = options.getAllValues();
        assertTrue(seen.get(0).isConsiderEquip());
        assertFalse(seen.get(1).isConsiderEquip());
        assertFalse(seen.get(1).isAllowGearPurchase());
        assertTrue(seen.get(1).isAllowMarket());
        assertTrue(seen.get(2).isConsiderEquip());
        assertTrue(seen.get(2).isAllowGearPurchase());
        verify(writer, times(1)).equip(anyLong(), anyList(), any());
    }

    @Test
    public void testRejectedExplore_DoesNotBlockGear() throws Exception {
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class)))
                .thenReturn(Action.of(ActionType.EXPLORE, "explore", new ExplorePayload(false)),
                        Action.waitFor("nothing to do"));
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenThrow(new WriteException(WriteErrorKind.UNCLASSIFIED, "execution reverted"));
        RunLoop loop = loop(engine);

        assertEquals(StepOutcome.FAILED, loop.step());
        loop.step();

        ArgumentCaptor<DecisionOptions> options = ArgumentCaptor.forClass(DecisionOptions.class);
        verify(engine, times(2)).decide(any(), any(), any(), options.capture());
        assertTrue(options.getAllValues().get(1).isConsiderEquip());
        assertTrue(options.getAllValues().get(1).isAllowGearPurchase());
    }

    @Test
    public void testRandomnessCircuit_OpensAndResyncsPeriodically() throws Exception {
        config.getRecovery().setRandomnessCircuitAttempts(2);
        config.getRecovery().setStaleProgressMs(Duration.ofHours(10).toMillis());
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenThrow(new WriteException(WriteErrorKind.RANDOMNESS_PENDING, "VRF request not fulfilled"));
        RunLoop loop = loop();
        long resyncInterval = config.getRecovery().getRandomnessResyncIntervalMs();

        assertEquals(StepOutcome.RANDOMNESS_WAIT, loop.step());
        clock.advanceMillis(config.getRecovery().getRandomnessBaseDelayMs());
        assertEquals(StepOutcome.RANDOMNESS_CIRCUIT_OPEN, loop.step());
        verify(events).log(eq(EventLevel.WARN), eq("randomness_circuit_open"), anyMap());
        assertEquals(resyncInterval, loop.delayAfter(StepOutcome.RANDOMNESS_CIRCUIT_OPEN));

        assertEquals(StepOutcome.RANDOMNESS_CIRCUIT_OPEN, loop.step());
        verify(writer, never()).resync();

        clock.advanceMillis(resyncInterval);
        assertEquals(StepOutcome.RANDOMNESS_CIRCUIT_OPEN, loop.step());
        verify(writer, times(1)).resync();
        assertEquals(StepOutcome.RANDOMNESS_CIRCUIT_OPEN, loop.step());
        verify(writer, times(1)).resync();
        verify(writer, times(2)).explore(anyLong(), anyBoolean(), any());

        clock.advanceMillis(config.getRecovery().getRandomnessCircuitOpenMs());
        assertEquals(StepOutcome.RANDOMNESS_WAIT, loop.step());
        verify(events).log(eq(EventLevel.INFO), eq("randomness_circuit_closed"), anyMap());
        verify(writer, times(3)).explore(anyLong(), anyBoolean(), any());
    }

    @Test
    public void testNotInBattle_Resyncs() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenThrow(new WriteException(WriteErrorKind.NOT_IN_BATTLE, "Not in battle"));
        RunLoop loop = loop();

        assertEquals(StepOutcome.RESYNCED, loop.step());
        verify(writer).resync();
        assertEquals(0, loop.getRuntime().getConsecutiveFailures());
    }

    @Test
    public void testFailureBudget_Rebootstraps() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenThrow(new IOException("malformed state"));
        RunLoop loop = loop();
        int budget = config.getRecovery().getMaxConsecutiveFailures();

        for (int i = 1; i < budget; i++) {
            assertEquals(StepOutcome.FAILED, loop.step());
            assertEquals(i, loop.getRuntime().getConsecutiveFailures());
        }
        assertEquals(StepOutcome.REBOOTSTRAPPED, loop.step());

        verify(bootstrapper, times(2)).bootstrap();
        assertEquals(0, loop.getRuntime().getConsecutiveFailures());
    }

    @Test
    public void testFailedRebootstrap_ResetsFailureCount() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenThrow(new IOException("malformed state"));
        RunLoop loop = loop();
        when(bootstrapper.bootstrap()).thenThrow(new IOException("bridge down"));
        int budget = config.getRecovery().getMaxConsecutiveFailures();

        StepOutcome last = null;
        for (int i = 0; i < budget; i++) {
            last = loop.step();
        }

        assertEquals(StepOutcome.FAILED, last);
        assertEquals(0, loop.getRuntime().getConsecutiveFailures());
    }

    // ========================================================================
    // Death
    // ========================================================================

    @Test
    public void testDeath_RotatesIdentity() throws Exception {
        GameReader nextReader = mock(GameReader.class);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.snapshot(Snapshots.adventurer(0, 50, 20)));
        when(bootstrapper.rotate(ADVENTURER)).thenReturn(new GameSession(43L, "0xabc", nextReader, writer));
        RunLoop loop = loop();

        assertEquals(StepOutcome.TERMINATED, loop.step());

        assertEquals(43L, loop.getSession().getAdventurerId());
        assertEquals(43L, loop.getRuntime().getAdventurerId());
        verify(events).milestone(eq(Milestones.DEATH), anyMap());
        verify(events).milestone(eq(Milestones.IDENTITY_ROTATED), anyMap());
        assertEquals(1, progress.getRuns().size());
        assertEquals(ADVENTURER, progress.getRuns().get(0).getAdventurerId());
        assertEquals(50, progress.getRuns().get(0).getEndXp());
    }

    @Test
    public void testDeath_FailedRotationRetriedAfterCooldown() throws Exception {
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.snapshot(Snapshots.adventurer(0, 50, 20)));
        when(bootstrapper.rotate(ADVENTURER)).thenThrow(new IOException("new game failed"));
        RunLoop loop = loop();

        assertEquals(StepOutcome.TERMINATED, loop.step());
        assertEquals(StepOutcome.TERMINATED, loop.step());
        verify(bootstrapper, times(1)).rotate(ADVENTURER);

        clock.advanceMillis(config.getRecovery().getDeathCooldownMs());
        assertEquals(StepOutcome.TERMINATED, loop.step());
        verify(bootstrapper, times(2)).rotate(ADVENTURER);
        assertEquals(ADVENTURER, loop.getSession().getAdventurerId());
    }

    @Test
    public void testDeath_StopsWhenRotationDisabled() throws Exception {
        config.getSession().setAutoRotateOnDeath(false);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.snapshot(Snapshots.adventurer(0, 50, 20)));
        RunLoop loop = loop();

        assertEquals(StepOutcome.TERMINATED, loop.step());

        assertTrue(stopSignal.isStopRequested());
        verify(bootstrapper, never()).rotate(anyLong());
    }

    // ========================================================================
    // Stalls, breaks and pacing
    // ========================================================================

    @Test
    public void testStalledProgress_Resyncs() throws Exception {
        config.getRecovery().setStaleProgressMs(10_000);
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class))).thenReturn(Action.waitFor("nothing to do"));
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        RunLoop loop = loop(engine);

        assertEquals(StepOutcome.WAITED, loop.step());
        clock.advanceMillis(9_999);
        assertEquals(StepOutcome.WAITED, loop.step());
        verify(writer, never()).resync();

        clock.advanceMillis(1);
        assertEquals(StepOutcome.STALLED, loop.step());
        verify(writer).resync();
        verify(events).log(eq(EventLevel.WARN), eq("stalled"), anyMap());

        assertEquals(StepOutcome.WAITED, loop.step());
        verify(writer, times(1)).resync();
    }

    @Test
    public void testBreak_DeferredDuringCombat() throws Exception {
        config.getPacing().setEnabled(true);
        config.getPacing().setThinkDelay(RangeMs.of(0, 0));
        config.getPacing().setIdentityJitterMaxMs(0);
        config.getPacing().setShortBreakEvery(RangeMs.of(60_000, 60_000));
        config.getPacing().setShortBreakDuration(RangeMs.of(30_000, 30_000));
        config.getPacing().setLongBreakEvery(RangeMs.of(Duration.ofHours(10).toMillis(), Duration.ofHours(10).toMillis()));
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class))).thenReturn(Action.waitFor("nothing to do"));
        when(reader.getWorldState(ADVENTURER)).thenReturn(
                Snapshots.snapshot(Snapshots.adventurer(100, 0, 3), Snapshots.beast(5, 30, 2)),
                Snapshots.exploring(0, 4));
        RunLoop loop = loop(engine);

        clock.advanceMillis(60_000);
        assertEquals(StepOutcome.WAITED, loop.step());
        assertTrue(sleeper.getSleeps().isEmpty());
        assertNotNull(loop.getRuntime().getBreaks().getPendingBreak());

        assertEquals(StepOutcome.ON_BREAK, loop.step());
        assertEquals(Collections.singletonList(30_000L), sleeper.getSleeps());
        assertEquals(1, loop.getRuntime().getBreaks().getShortBreaksTaken());
        assertNull(loop.getRuntime().getBreaks().getPendingBreak());

        assertEquals(StepOutcome.WAITED, loop.step());
    }

    @Test
    public void testPacing_ThinkDelayAndMarketDwellPrecedeWrites() throws Exception {
        config.getPacing().setEnabled(true);
        config.getPacing().setThinkDelay(RangeMs.of(700, 700));
        config.getPacing().setMarketDwell(RangeMs.of(2_000, 2_000));
        DecisionEngine engine = mock(DecisionEngine.class);
        when(engine.decide(any(DerivedState.class), any(PolicyConfig.class), any(ItemCatalog.class),
                any(DecisionOptions.class)))
                .thenReturn(Action.of(ActionType.BUY_POTIONS, "low health", new PotionPurchase(2, 4)),
                        Action.of(ActionType.EXPLORE, "explore", new ExplorePayload(false)));
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(9, 3), Snapshots.exploring(9, 4));
        when(writer.buyPotions(anyLong(), anyInt())).thenReturn(new SettlementHandle("0x1", clock.instant()));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenReturn(new SettlementHandle("0x2", clock.instant()));
        when(reader.getTransactionStatus(anyString())).thenReturn(TxStatus.SUCCEEDED);
        RunLoop loop = loop(engine);

        assertEquals(StepOutcome.ACTED, loop.step());
        assertEquals(Collections.singletonList(700L), sleeper.getSleeps());

        assertEquals(StepOutcome.ACTED, loop.step());
        assertEquals(Arrays.asList(700L, 2_700L), sleeper.getSleeps());
    }

    @Test
    public void testRateLimit_CountsRejectedWrites() throws Exception {
        config.getPacing().setMaxWritesPerMinute(1);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any()))
                .thenThrow(new WriteException(WriteErrorKind.UNCLASSIFIED, "execution reverted"));
        RunLoop loop = loop();

        assertEquals(StepOutcome.FAILED, loop.step());
        assertTrue(sleeper.getSleeps().isEmpty());
        assertEquals(1, loop.getRuntime().getRateLimiter().recentCount());

        assertEquals(StepOutcome.FAILED, loop.step());
        assertEquals(Collections.singletonList(60_000L), sleeper.getSleeps());
        verify(writer, times(2)).explore(anyLong(), anyBoolean(), any());
    }

    @Test
    public void testRateLimit_CountsUnconfirmedWrites() throws Exception {
        config.getPacing().setMaxWritesPerMinute(1);
        config.getRecovery().setWriteTimeoutMs(50);
        when(reader.getWorldState(ADVENTURER)).thenReturn(Snapshots.exploring(0, 3));
        when(writer.explore(anyLong(), anyBoolean(), any())).thenAnswer(invocation -> {
            release.await();
            return unreported();
        });
        RunLoop loop = loop();

        assertEquals(StepOutcome.WRITE_UNCONFIRMED, loop.step());
        assertEquals(1, loop.getRuntime().getRateLimiter().recentCount());
    }

    // ========================================================================
    // Delays
    // ========================================================================

    @Test
    public void testDelayAfter() throws Exception {
        RunLoop loop = loop();

        assertEquals(0, loop.delayAfter(StepOutcome.ACTED));
        assertEquals(config.getRecovery().getSettlementPollIntervalMs(),
                loop.delayAfter(StepOutcome.AWAITING_SETTLEMENT));
        assertEquals(config.getRecovery().getIdlePollMs(), loop.delayAfter(StepOutcome.WAITED));
        assertEquals(config.getRecovery().getFailureBackoffMs(), loop.delayAfter(StepOutcome.FAILED));
    }
}
