package com.vigil.state;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.vigil.data.ItemSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure transform from a {@link RawSnapshot} to a {@link DerivedState}.
 *
 * <p>No I/O and no mutable state: the same snapshot always yields an equal result.
 * Malformed values never abort derivation, they read as zero.
 */
public class StateDeriver {

    private static final String BAG_ITEM_PREFIX = "item_";

    private final int hpBase;
    private final int hpPerVitality;

    /**
     * @param hpBase        max health with zero vitality
     * @param hpPerVitality max health gained per vitality point
     */
    public StateDeriver(int hpBase, int hpPerVitality) {
        this.hpBase = hpBase;
        this.hpPerVitality = hpPerVitality;
    }

    public DerivedState derive(long adventurerId, RawSnapshot snapshot) {
        JsonObject adventurer = snapshot.getAdventurer();
        JsonObject statsJson = objectOrEmpty(adventurer, "stats");

        Stats stats = Stats.builder()
                .strength(ChainValues.toInt(statsJson, "strength"))
                .dexterity(ChainValues.toInt(statsJson, "dexterity"))
                .vitality(ChainValues.toInt(statsJson, "vitality"))
                .intelligence(ChainValues.toInt(statsJson, "intelligence"))
                .wisdom(ChainValues.toInt(statsJson, "wisdom"))
                .charisma(ChainValues.toInt(statsJson, "charisma"))
                .luck(ChainValues.toInt(statsJson, "luck"))
                .build();

        int hp = Math.max(0, ChainValues.toInt(adventurer, "health"));
        int maxHp = Math.max(0, hpBase + hpPerVitality * stats.getVitality());
        double hpPct = maxHp > 0 ? (double) hp / maxHp : 1.0;
        int xp = Math.max(0, ChainValues.toInt(adventurer, "xp"));
        int level = levelFromXp(xp);

        JsonObject beastJson = snapshot.getBeast();
        Beast beast = new Beast(
                ChainValues.toInt(beastJson, "id"),
                Math.max(0, ChainValues.toInt(beastJson, "health")),
                ChainValues.toInt(beastJson, "level"),
                ChainValues.toBoolean(beastJson.get("is_collectable")));

        return DerivedState.builder()
                .adventurerId(adventurerId)
                .hp(hp)
                .maxHp(maxHp)
                .hpPct(hpPct)
                .xp(xp)
                .level(level)
                .gold(Math.max(0, ChainValues.toInt(adventurer, "gold")))
                .actionCount(Math.max(0, ChainValues.toLong(adventurer, "action_count")))
                .stats(stats)
                .statUpgrades(Math.max(0, ChainValues.toInt(adventurer, "stat_upgrades_available")))
                .beast(beast)
                .inCombat(beast.isAlive())
                .fleeChance(ratio(stats.getDexterity(), level))
                .avoidObstacleChance(ratio(stats.getIntelligence(), level))
                .avoidAmbushChance(ratio(stats.getWisdom(), level))
                .bagItems(parseBag(snapshot.getBag()))
                .equipment(parseEquipment(objectOrEmpty(adventurer, "equipment")))
                .market(parseMarket(snapshot.getMarket()))
                .build();
    }

    // ========================================================================
    // Contract formulas
    // ========================================================================

    /**
     * Adventurer level from experience: 1 at zero xp, otherwise the integer square
     * root of xp (never below 1). Monotonic non-decreasing in xp.
     */
    public static int levelFromXp(int xp) {
        if (xp <= 0) {
            return 1;
        }
        return Math.max(1, (int) Math.floor(Math.sqrt(xp)));
    }

    /**
     * Attribute-versus-level ratio clamped to [0, 1].
     */
    static double ratio(int attribute, int level) {
        double value = (double) Math.max(0, attribute) / Math.max(1, level);
        return Math.min(1.0, Math.max(0.0, value));
    }

    // ========================================================================
    // Inventory parsing
    // ========================================================================

    private static List<Item> parseBag(JsonObject bag) {
        List<Item> items = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : bag.entrySet()) {
            if (!entry.getKey().startsWith(BAG_ITEM_PREFIX)) {
                continue;
            }
            Item item = parseItem(entry.getValue());
            if (item != null) {
                items.add(item);
            }
        }
        return Collections.unmodifiableList(items);
    }

    private static Equipment parseEquipment(JsonObject equipment) {
        Map<ItemSlot, Item> slots = new EnumMap<>(ItemSlot.class);
        for (ItemSlot slot : ItemSlot.values()) {
            if (slot == ItemSlot.NONE) {
                continue;
            }
            Item item = parseItem(equipment.get(slot.name().toLowerCase(Locale.ROOT)));
            if (item != null) {
                slots.put(slot, item);
            }
        }
        return new Equipment(slots);
    }

    private static List<Integer> parseMarket(JsonElement market) {
        if (market == null || !market.isJsonArray()) {
            return Collections.emptyList();
        }
        JsonArray array = market.getAsJsonArray();
        List<Integer> ids = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            int id = ChainValues.toInt(element);
            if (id > 0) {
                ids.add(id);
            }
        }
        return Collections.unmodifiableList(ids);
    }

    private static Item parseItem(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        JsonObject object = element.getAsJsonObject();
        int id = ChainValues.toInt(object, "id");
        if (id <= 0) {
            return null;
        }
        return new Item(id, Math.max(0, ChainValues.toInt(object, "xp")));
    }

    private static JsonObject objectOrEmpty(JsonObject parent, String key) {
        JsonElement element = parent != null ? parent.get(key) : null;
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
    }
}
