package com.vigil.chain;

import java.io.IOException;

/**
 * A read failed for a reason worth retrying in place: connection reset, timeout,
 * or a 5xx from the bridge or RPC node.
 */
public class TransientReadException extends IOException {

    public TransientReadException(String message) {
        super(message);
    }

    public TransientReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
