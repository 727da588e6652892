package com.vigil.chain;

import lombok.Getter;

import java.io.IOException;

/**
 * A JSON-RPC call returned an {@code error} object.
 */
@Getter
public class JsonRpcException extends IOException {

    private final int code;

    public JsonRpcException(int code, String message) {
        super("JSON-RPC error " + code + ": " + message);
        this.code = code;
    }
}
