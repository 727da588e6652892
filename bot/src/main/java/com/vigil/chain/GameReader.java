package com.vigil.chain;

import com.vigil.data.ItemMetaSource;
import com.vigil.state.RawSnapshot;

import java.io.IOException;

/**
 * Read side of the game. Every method is idempotent and safe to retry.
 */
public interface GameReader extends ItemMetaSource {

    /**
     * @throws TransientReadException for network failures worth retrying in place
     * @throws IOException            for anything else (malformed response, 4xx)
     */
    RawSnapshot getWorldState(long adventurerId) throws IOException;

    /**
     * Status of a submitted transaction, used for settlement polling.
     */
    TxStatus getTransactionStatus(String txHash) throws IOException;
}
