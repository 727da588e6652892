package com.vigil.state;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import lombok.Value;

/**
 * World state exactly as the reader returned it: the adventurer record, the
 * active beast, the bag and the market list. Values keep their on-chain encodings
 * (numbers, hex strings, Cairo enum objects); {@link ChainValues} normalizes them.
 */
@Value
public class RawSnapshot {

    JsonObject adventurer;
    JsonObject beast;
    JsonObject bag;
    JsonElement market;

    public RawSnapshot(JsonObject adventurer, JsonObject beast, JsonObject bag, JsonElement market) {
        this.adventurer = adventurer != null ? adventurer : new JsonObject();
        this.beast = beast != null ? beast : new JsonObject();
        this.bag = bag != null ? bag : new JsonObject();
        this.market = market != null ? market : JsonNull.INSTANCE;
    }

    /**
     * Build from the {@code get_game_state} response shape:
     * {@code {"adventurer": {...}, "beast": {...}, "bag": {...}, "market": [...]}}.
     */
    public static RawSnapshot fromGameState(JsonObject gameState) {
        return new RawSnapshot(
                objectOrNull(gameState, "adventurer"),
                objectOrNull(gameState, "beast"),
                objectOrNull(gameState, "bag"),
                gameState != null ? gameState.get("market") : null);
    }

    private static JsonObject objectOrNull(JsonObject parent, String key) {
        if (parent == null) {
            return null;
        }
        JsonElement element = parent.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }
}
