package com.vigil.chain;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC 2.0 client for a Starknet node.
 */
@Slf4j
public class JsonRpcClient {

    private final OkHttpClient httpClient;
    private final String url;
    private final Gson gson;
    private final AtomicLong nextId = new AtomicLong(1);

    public JsonRpcClient(OkHttpClient baseClient, String url, long timeoutMs, Gson gson) {
        this.url = url;
        this.gson = gson;
        this.httpClient = baseClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * @return the {@code result} member
     * @throws JsonRpcException       when the node returns an error object
     * @throws TransientReadException on network failure, 429 or 5xx
     */
    public JsonElement call(String method, JsonElement params) throws IOException {
        JsonObject envelope = new JsonObject();
        envelope.addProperty("jsonrpc", "2.0");
        envelope.addProperty("id", nextId.getAndIncrement());
        envelope.addProperty("method", method);
        envelope.add("params", params);

        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .post(RequestBody.create(gson.toJson(envelope), BridgeHttpClient.JSON))
                .build();

        String text;
        int status;
        try (Response response = httpClient.newCall(request).execute()) {
            status = response.code();
            ResponseBody body = response.body();
            text = body != null ? body.string() : "";
        } catch (IOException e) {
            throw new TransientReadException(method + " failed: " + e.getMessage(), e);
        }

        if (status == 429 || status >= 500) {
            throw new TransientReadException("RPC node returned HTTP " + status + " for " + method);
        }
        if (status < 200 || status >= 300) {
            throw new IOException("RPC node returned HTTP " + status + " for " + method + ": "
                    + BridgeHttpClient.abbreviate(text));
        }

        JsonObject reply = BridgeHttpClient.parseObject(text);
        if (reply.has("error") && reply.get("error").isJsonObject()) {
            JsonObject error = reply.getAsJsonObject("error");
            int code = error.has("code") ? error.get("code").getAsInt() : 0;
            String message = error.has("message") ? error.get("message").getAsString() : "unknown error";
            log.debug("{} returned error {}: {}", method, code, message);
            throw new JsonRpcException(code, message);
        }
        if (!reply.has("result")) {
            throw new IOException("JSON-RPC reply without result for " + method);
        }
        return reply.get("result");
    }
}
