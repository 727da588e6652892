package com.vigil.chain;

import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Returned by every write. The transaction hash is absent when the signer layer
 * accepted the call without reporting one; settlement is then only observable
 * through the adventurer's action count.
 */
@Value
public class SettlementHandle {

    @Nullable
    String txHash;

    Instant submittedAt;

    public boolean hasTxHash() {
        return txHash != null && !txHash.isEmpty();
    }
}
