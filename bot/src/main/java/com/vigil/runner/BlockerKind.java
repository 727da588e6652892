package com.vigil.runner;

/**
 * Failure modes that temporarily exclude work, keyed to the current action count.
 */
public enum BlockerKind {
    RANDOMNESS,
    MARKET,
    STATS,
    /**
     * Equip and item purchases after the contract rejected one for an unclassified reason.
     */
    GEAR
}
