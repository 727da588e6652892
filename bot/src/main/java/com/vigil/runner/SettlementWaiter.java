package com.vigil.runner;

import com.vigil.chain.GameReader;
import com.vigil.chain.TxStatus;
import com.vigil.config.RecoveryConfig;
import com.vigil.state.DerivedState;
import com.vigil.state.StateDeriver;
import com.vigil.timing.Sleeper;
import com.vigil.timing.StopSignal;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;

/**
 * Polls until a submitted write is visibly settled. With a transaction hash the
 * receipt is authoritative; without one the adventurer's action count is.
 */
@Slf4j
public class SettlementWaiter {

    private final RecoveryConfig recovery;
    private final StateDeriver deriver;
    private final Clock clock;
    private final Sleeper sleeper;
    private final StopSignal stopSignal;

    public SettlementWaiter(RecoveryConfig recovery, StateDeriver deriver, Clock clock,
                            Sleeper sleeper, StopSignal stopSignal) {
        this.recovery = recovery;
        this.deriver = deriver;
        this.clock = clock;
        this.sleeper = sleeper;
        this.stopSignal = stopSignal;
    }

    public SettlementResult await(GameReader reader, long adventurerId, PendingSettlement pending)
            throws InterruptedException {
        long started = clock.millis();
        long deadline = started + recovery.getSettlementTimeoutMs();
        int polls = 0;

        while (!stopSignal.isStopRequested()) {
            polls++;
            try {
                if (pending.getTxHash() != null) {
                    TxStatus status = reader.getTransactionStatus(pending.getTxHash());
                    if (status.isSuccess()) {
                        log.debug("{} settled after {} polls ({}ms)", pending.getType(), polls, clock.millis() - started);
                        return SettlementResult.CONFIRMED;
                    }
                    if (status.isTerminal()) {
                        log.warn("{} ended {} (tx {})", pending.getType(), status, pending.getTxHash());
                        return SettlementResult.REVERTED;
                    }
                } else {
                    DerivedState state = deriver.derive(adventurerId, reader.getWorldState(adventurerId));
                    if (pending.isSatisfiedBy(state)) {
                        log.debug("{} visible at action count {} after {} polls",
                                pending.getType(), state.getActionCount(), polls);
                        return SettlementResult.CONFIRMED;
                    }
                }
            } catch (IOException e) {
                log.debug("Settlement poll {} failed: {}", polls, e.getMessage());
            }

            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                log.warn("{} not settled within {}ms (expected action count {}, {} polls)",
                        pending.getType(), recovery.getSettlementTimeoutMs(), pending.getExpectedActionCount(), polls);
                return SettlementResult.TIMED_OUT;
            }
            sleeper.sleep(Math.min(remaining, recovery.getSettlementPollIntervalMs()));
        }
        return SettlementResult.STOPPED;
    }
}
