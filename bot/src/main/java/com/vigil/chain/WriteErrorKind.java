package com.vigil.chain;

/**
 * Structured failure kinds every {@link GameWriter} reports, so the run loop never
 * matches error text itself.
 */
public enum WriteErrorKind {
    /**
     * The randomness draw the action depends on has not been fulfilled yet.
     */
    RANDOMNESS_PENDING,
    MARKET_CLOSED,
    /**
     * The contract thinks no beast is present; the execution layer may be desynced.
     */
    NOT_IN_BATTLE,
    /**
     * Stat selection rejected, usually because no points are available yet.
     */
    STATS_BLOCKED,
    /**
     * The adventurer is dead on chain.
     */
    DEAD_ADVENTURER,
    /**
     * The signer layer is not reachable or lost its session.
     */
    SIGNER_UNAVAILABLE,
    UNCLASSIFIED
}
