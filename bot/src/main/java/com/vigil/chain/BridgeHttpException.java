package com.vigil.chain;

import lombok.Getter;

import java.io.IOException;

/**
 * The bridge answered with a non-retryable HTTP status. The body is kept because
 * it usually carries the signer's error text.
 */
@Getter
public class BridgeHttpException extends IOException {

    private final int status;
    private final String body;

    public BridgeHttpException(int status, String body) {
        super("Bridge returned HTTP " + status + (body.isEmpty() ? "" : ": " + body));
        this.status = status;
        this.body = body;
    }
}
