package com.vigil.chain;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * JSON over HTTP to the local bridge that fronts the chain, the item catalog and
 * the signer.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>connection errors, timeouts, 429 and 5xx: {@link TransientReadException}</li>
 *   <li>other non-2xx: {@link BridgeHttpException} with the response body</li>
 *   <li>a body that is not a JSON object: plain {@link IOException}</li>
 * </ul>
 */
@Slf4j
public class BridgeHttpClient {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final String USER_AGENT = "vigil-runner/1.0";

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final Gson gson;

    public BridgeHttpClient(OkHttpClient baseClient, String baseUrl, String token, long timeoutMs, Gson gson) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid bridge URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.gson = gson;
        this.httpClient = baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request.Builder request = chain.request().newBuilder()
                            .header("User-Agent", USER_AGENT)
                            .header("Accept", "application/json");
                    if (token != null && !token.isEmpty()) {
                        request.header("Authorization", "Bearer " + token);
                    }
                    return chain.proceed(request.build());
                })
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    public JsonObject get(String path) throws IOException {
        Request request = new Request.Builder()
                .url(resolve(path))
                .get()
                .build();
        return execute(request);
    }

    public JsonObject post(String path, JsonElement body) throws IOException {
        Request request = new Request.Builder()
                .url(resolve(path))
                .post(RequestBody.create(gson.toJson(body), JSON))
                .build();
        return execute(request);
    }

    HttpUrl resolve(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        return baseUrl.newBuilder().addPathSegments(trimmed).build();
    }

    private JsonObject execute(Request request) throws IOException {
        String text;
        int status;
        try (Response response = httpClient.newCall(request).execute()) {
            status = response.code();
            ResponseBody body = response.body();
            text = body != null ? body.string() : "";
        } catch (IOException e) {
            throw new TransientReadException(request.method() + " " + request.url().encodedPath()
                    + " failed: " + e.getMessage(), e);
        }

        if (status == 429 || status >= 500) {
            log.debug("Bridge {} {} returned {}", request.method(), request.url().encodedPath(), status);
            throw new TransientReadException("Bridge returned HTTP " + status + " for " + request.url().encodedPath());
        }
        if (status < 200 || status >= 300) {
            throw new BridgeHttpException(status, text);
        }
        return parseObject(text);
    }

    static JsonObject parseObject(String text) throws IOException {
        if (text == null || text.trim().isEmpty()) {
            return new JsonObject();
        }
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                throw new IOException("Expected a JSON object, got: " + abbreviate(text));
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON from bridge: " + abbreviate(text), e);
        }
    }

    static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
