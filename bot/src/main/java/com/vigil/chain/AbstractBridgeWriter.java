package com.vigil.chain;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.vigil.config.ChainConfig;
import com.vigil.decision.ItemPurchase;
import com.vigil.decision.StatAllocation;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * Shared entrypoint wiring for writers that submit through the local bridge.
 * Subclasses only decide how one call reaches a signer.
 */
@Slf4j
public abstract class AbstractBridgeWriter implements GameWriter {

    protected final BridgeHttpClient bridge;
    protected final GameCalls calls;
    protected final ChainConfig config;
    protected final Clock clock;

    protected AbstractBridgeWriter(BridgeHttpClient bridge, ChainConfig config, Clock clock) {
        this.bridge = bridge;
        this.calls = new GameCalls(config.getGameContract());
        this.config = config;
        this.clock = clock;
    }

    /**
     * Submit one call as one transaction, preceded by a randomness request when a salt is given.
     */
    protected abstract SettlementHandle submit(ContractCall call, @Nullable RandomnessSalt salt) throws WriteException;

    // ========================================================================
    // Game entrypoints
    // ========================================================================

    @Override
    public SettlementHandle startGame(long adventurerId, int weaponId) throws WriteException {
        return submit(calls.startGame(adventurerId, weaponId), null);
    }

    @Override
    public SettlementHandle explore(long adventurerId, boolean tillBeast, @Nullable RandomnessSalt salt) throws WriteException {
        return submit(calls.explore(adventurerId, tillBeast), effective(salt));
    }

    @Override
    public SettlementHandle attack(long adventurerId, boolean toTheDeath, @Nullable RandomnessSalt salt) throws WriteException {
        return submit(calls.attack(adventurerId, toTheDeath), effective(salt));
    }

    @Override
    public SettlementHandle flee(long adventurerId, boolean toTheDeath, @Nullable RandomnessSalt salt) throws WriteException {
        return submit(calls.flee(adventurerId, toTheDeath), effective(salt));
    }

    @Override
    public SettlementHandle buyItems(long adventurerId, List<ItemPurchase> items, int potions) throws WriteException {
        return submit(calls.buyItems(adventurerId, potions, items), null);
    }

    @Override
    public SettlementHandle buyPotions(long adventurerId, int count) throws WriteException {
        return submit(calls.buyItems(adventurerId, count, Collections.emptyList()), null);
    }

    @Override
    public SettlementHandle equip(long adventurerId, List<Integer> itemIds, @Nullable RandomnessSalt salt) throws WriteException {
        return submit(calls.equip(adventurerId, itemIds), effective(salt));
    }

    @Override
    public SettlementHandle selectStatUpgrades(long adventurerId, StatAllocation allocation) throws WriteException {
        return submit(calls.selectStatUpgrades(adventurerId, allocation), null);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    @Nullable
    private RandomnessSalt effective(@Nullable RandomnessSalt salt) {
        return config.isAttachRandomnessSalt() ? salt : null;
    }

    protected JsonObject callJson(ContractCall call) {
        JsonObject json = new JsonObject();
        json.addProperty("contractAddress", call.getContractAddress());
        json.addProperty("entrypoint", call.getEntrypoint());
        json.add("calldata", strings(call.getCalldata()));
        return json;
    }

    protected static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    /**
     * Turn a bridge reply into a handle, or throw the classified signer error.
     */
    protected SettlementHandle handleFrom(String entrypoint, JsonObject reply) throws WriteException {
        String error = errorText(reply);
        if (error != null) {
            throw WriteException.classified(error);
        }
        String txHash = null;
        for (String key : new String[]{"transaction_hash", "transactionHash", "txHash"}) {
            JsonElement value = reply.get(key);
            if (value != null && value.isJsonPrimitive()) {
                txHash = value.getAsString();
                break;
            }
        }
        log.debug("Submitted {} (tx {})", entrypoint, txHash != null ? txHash : "unreported");
        return new SettlementHandle(txHash, clock.instant());
    }

    /**
     * Error text from {@code {"ok": false, "error": ...}}, where error is a string or
     * an object with {@code text} or {@code message}. Null when the reply is a success.
     */
    @Nullable
    static String errorText(JsonObject reply) {
        JsonElement ok = reply.get("ok");
        JsonElement error = reply.get("error");
        boolean failed = (ok != null && ok.isJsonPrimitive() && !ok.getAsBoolean())
                || (error != null && !error.isJsonNull());
        if (!failed) {
            return null;
        }
        if (error == null || error.isJsonNull()) {
            return "unknown error";
        }
        if (error.isJsonPrimitive()) {
            return error.getAsString();
        }
        if (error.isJsonObject()) {
            JsonObject object = error.getAsJsonObject();
            for (String key : new String[]{"text", "message"}) {
                if (object.has(key) && object.get(key).isJsonPrimitive()) {
                    return object.get(key).getAsString();
                }
            }
        }
        return error.toString();
    }

    /**
     * Error text carried by a failed HTTP exchange: the body's error when it has one,
     * otherwise the exception message.
     */
    static String errorText(IOException e) {
        if (e instanceof BridgeHttpException) {
            String body = ((BridgeHttpException) e).getBody();
            try {
                String text = errorText(BridgeHttpClient.parseObject(body));
                if (text != null) {
                    return text;
                }
            } catch (IOException parseFailure) {
                log.debug("Bridge error body is not JSON: {}", parseFailure.getMessage());
            }
            return body.isEmpty() ? e.getMessage() : body;
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
