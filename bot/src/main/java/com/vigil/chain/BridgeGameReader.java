package com.vigil.chain;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.vigil.data.DamageType;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.ChainValues;
import com.vigil.state.RawSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads world state and the loot catalog from the bridge, and transaction
 * receipts from the Starknet RPC node.
 */
@Slf4j
public class BridgeGameReader implements GameReader {

    /**
     * Starknet RPC error code for an unknown transaction hash.
     */
    static final int TXN_HASH_NOT_FOUND = 29;

    private final BridgeHttpClient bridge;
    private final JsonRpcClient rpc;

    public BridgeGameReader(BridgeHttpClient bridge, JsonRpcClient rpc) {
        this.bridge = bridge;
        this.rpc = rpc;
    }

    @Override
    public RawSnapshot getWorldState(long adventurerId) throws IOException {
        JsonObject state = bridge.get("/state/" + adventurerId);
        if (!state.has("adventurer")) {
            throw new IOException("World state for adventurer " + adventurerId + " has no adventurer record");
        }
        return RawSnapshot.fromGameState(state);
    }

    @Override
    public Optional<ItemMeta> fetchItemMeta(int itemId) throws IOException {
        JsonObject item;
        try {
            item = bridge.get("/item/" + itemId);
        } catch (BridgeHttpException e) {
            if (e.getStatus() == 404) {
                return Optional.empty();
            }
            throw e;
        }

        int tier = ChainValues.toTier(item.get("tier"));
        ItemSlot slot = ItemSlot.fromName(ChainValues.enumKey(item.get("slot")));
        DamageType type = DamageType.fromName(ChainValues.enumKey(
                item.has("item_type") ? item.get("item_type") : item.get("type")));
        if (slot == ItemSlot.NONE && tier == 0) {
            log.debug("Catalog has no entry for item {}", itemId);
            return Optional.empty();
        }
        return Optional.of(ItemMeta.builder()
                .id(itemId)
                .tier(tier)
                .slot(slot)
                .damageType(type)
                .build());
    }

    /**
     * Maps {@code starknet_getTransactionReceipt}: reverted wins over finality,
     * success requires the transaction to be accepted on L2 or L1, and an unknown
     * hash is still pending.
     */
    @Override
    public TxStatus getTransactionStatus(String txHash) throws IOException {
        JsonArray params = new JsonArray();
        params.add(txHash);

        JsonElement result;
        try {
            result = rpc.call("starknet_getTransactionReceipt", params);
        } catch (JsonRpcException e) {
            if (e.getCode() == TXN_HASH_NOT_FOUND) {
                return TxStatus.PENDING;
            }
            throw e;
        }
        if (result == null || !result.isJsonObject()) {
            return TxStatus.UNKNOWN;
        }
        return statusOf(result.getAsJsonObject());
    }

    static TxStatus statusOf(JsonObject receipt) {
        String execution = upper(receipt, "execution_status");
        String finality = upper(receipt, "finality_status");

        if ("REVERTED".equals(execution)) {
            return TxStatus.REVERTED;
        }
        if ("REJECTED".equals(finality) || "REJECTED".equals(execution)) {
            return TxStatus.REJECTED;
        }
        if ("SUCCEEDED".equals(execution)
                && ("ACCEPTED_ON_L2".equals(finality) || "ACCEPTED_ON_L1".equals(finality))) {
            return TxStatus.SUCCEEDED;
        }
        if (finality.isEmpty() && execution.isEmpty()) {
            return TxStatus.UNKNOWN;
        }
        return TxStatus.PENDING;
    }

    private static String upper(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            return "";
        }
        return value.getAsString().trim().toUpperCase(Locale.ROOT);
    }
}
