package com.vigil.runner;

/**
 * What one run-loop iteration did. The loop picks its next delay from this.
 */
public enum StepOutcome {
    STOPPED,
    /**
     * A previous write has not shown up in the action count yet.
     */
    AWAITING_SETTLEMENT,
    TERMINATED,
    RANDOMNESS_CIRCUIT_OPEN,
    RANDOMNESS_WAIT,
    ON_BREAK,
    /**
     * No progress within the stale threshold; the execution layer was resynced.
     */
    STALLED,
    ACTED,
    /**
     * The submission raced past the write timeout; it may still land.
     */
    WRITE_UNCONFIRMED,
    /**
     * A policy block was recorded; the next iteration decides without it.
     */
    BLOCKED,
    RESYNCED,
    WAITED,
    FAILED,
    REBOOTSTRAPPED
}
