package com.vigil.runner;

import com.vigil.decision.ActionType;
import com.vigil.state.DerivedState;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * A write whose effect has not been observed yet.
 */
@Value
public class PendingSettlement {

    long expectedActionCount;

    long submittedAtMillis;

    @Nullable
    String txHash;

    ActionType type;

    /**
     * Settled once the action count catches up. A new game also counts as settled
     * as soon as the adventurer is alive.
     */
    public boolean isSatisfiedBy(DerivedState state) {
        if (state.getActionCount() >= expectedActionCount) {
            return true;
        }
        return type == ActionType.START_GAME && !state.isNotStarted();
    }
}
