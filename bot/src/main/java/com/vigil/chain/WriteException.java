package com.vigil.chain;

import lombok.Getter;

/**
 * A write was rejected or could not be submitted. The message is the signer's
 * error text, verbatim.
 */
@Getter
public class WriteException extends Exception {

    private final WriteErrorKind kind;

    public WriteException(WriteErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WriteException(WriteErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static WriteException classified(String message) {
        return new WriteException(WriteErrorClassifier.classify(message), message);
    }

    public static WriteException classified(String message, Throwable cause) {
        return new WriteException(WriteErrorClassifier.classify(message), message, cause);
    }
}
