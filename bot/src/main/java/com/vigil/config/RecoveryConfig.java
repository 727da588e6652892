package com.vigil.config;

import lombok.Data;

/**
 * Timeouts, backoff and budgets for the run loop's failure handling.
 */
@Data
public class RecoveryConfig {

    /**
     * Bound on a single submission; past it the write is treated as unconfirmed.
     */
    private long writeTimeoutMs = 45_000;

    /**
     * Bound on polling a submitted transaction for a terminal status.
     */
    private long settlementTimeoutMs = 120_000;
    private long settlementPollIntervalMs = 1_500;

    /**
     * How long later iterations wait for the action count to catch up before recovering.
     */
    private long awaitSettlementTimeoutMs = 180_000;

    /**
     * No xp or action-count progress for this long means the run is stalled.
     */
    private long staleProgressMs = 240_000;

    private int maxConsecutiveFailures = 5;
    private long failureBackoffMs = 1_500;
    private long idlePollMs = 1_000;

    private long deathCooldownMs = 5_000;

    // ========================================================================
    // Randomness (VRF) fulfilment
    // ========================================================================

    private long randomnessBaseDelayMs = 2_000;
    private long randomnessMaxDelayMs = 60_000;
    private int randomnessCircuitAttempts = 12;
    private long randomnessCircuitWindowMs = 10 * 60_000;
    private long randomnessCircuitOpenMs = 30 * 60_000;
    private long randomnessResyncIntervalMs = 2 * 60_000;

    // ========================================================================
    // Policy-blocked cooldowns
    // ========================================================================

    private long marketClosedCooldownMs = 60_000;
    private long statsBlockedCooldownMs = 60_000;
    private long gearRejectedCooldownMs = 120_000;
}
