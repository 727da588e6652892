package com.vigil.chain;

/**
 * Settlement status of a submitted transaction as seen through its receipt.
 */
public enum TxStatus {
    /**
     * Not yet known to the node, or received but not executed.
     */
    PENDING,
    SUCCEEDED,
    REVERTED,
    REJECTED,
    /**
     * The receipt could not be interpreted.
     */
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == REVERTED || this == REJECTED;
    }

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
