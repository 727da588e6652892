package com.vigil.runner;

public enum SettlementResult {
    CONFIRMED,
    REVERTED,
    /**
     * Neither outcome was observed within the settlement timeout.
     */
    TIMED_OUT,
    STOPPED
}
