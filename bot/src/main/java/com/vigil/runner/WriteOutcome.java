package com.vigil.runner;

import com.vigil.chain.SettlementHandle;
import com.vigil.chain.WriteException;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Result of racing one submission against the write timeout.
 */
@Value
public class WriteOutcome {

    public enum Status {
        SUBMITTED,
        /**
         * The submission did not return in time. It may still land.
         */
        TIMED_OUT,
        FAILED
    }

    Status status;

    @Nullable
    SettlementHandle handle;

    @Nullable
    WriteException error;

    long elapsedMs;

    public static WriteOutcome submitted(SettlementHandle handle, long elapsedMs) {
        return new WriteOutcome(Status.SUBMITTED, handle, null, elapsedMs);
    }

    public static WriteOutcome timedOut(long elapsedMs) {
        return new WriteOutcome(Status.TIMED_OUT, null, null, elapsedMs);
    }

    public static WriteOutcome failed(WriteException error, long elapsedMs) {
        return new WriteOutcome(Status.FAILED, null, error, elapsedMs);
    }
}
