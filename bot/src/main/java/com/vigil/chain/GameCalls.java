package com.vigil.chain;

import com.vigil.decision.ItemPurchase;
import com.vigil.decision.StatAllocation;
import com.vigil.state.StatType;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes game entrypoints to Cairo calldata. Arrays are length-prefixed and
 * booleans are 0 or 1.
 */
public final class GameCalls {

    public static final String START_GAME = "start_game";
    public static final String EXPLORE = "explore";
    public static final String ATTACK = "attack";
    public static final String FLEE = "flee";
    public static final String BUY_ITEMS = "buy_items";
    public static final String EQUIP = "equip";
    public static final String SELECT_STAT_UPGRADES = "select_stat_upgrades";
    public static final String REQUEST_RANDOM = "request_random";

    /**
     * Variant index of {@code Source::Salt} in the randomness provider's source enum.
     */
    static final String SOURCE_SALT = "1";

    private static final StatType[] STAT_ORDER = {
            StatType.STRENGTH, StatType.DEXTERITY, StatType.VITALITY, StatType.INTELLIGENCE,
            StatType.WISDOM, StatType.CHARISMA, StatType.LUCK
    };

    private final String gameContract;

    public GameCalls(String gameContract) {
        this.gameContract = gameContract;
    }

    public ContractCall startGame(long adventurerId, int weaponId) {
        return call(START_GAME, felt(adventurerId), felt(weaponId));
    }

    public ContractCall explore(long adventurerId, boolean tillBeast) {
        return call(EXPLORE, felt(adventurerId), bool(tillBeast));
    }

    public ContractCall attack(long adventurerId, boolean toTheDeath) {
        return call(ATTACK, felt(adventurerId), bool(toTheDeath));
    }

    public ContractCall flee(long adventurerId, boolean toTheDeath) {
        return call(FLEE, felt(adventurerId), bool(toTheDeath));
    }

    /**
     * {@code buy_items(adventurer_id, potions, items: Array<(item_id, equip)>)}. Buying
     * potions alone is an empty item array.
     */
    public ContractCall buyItems(long adventurerId, int potions, List<ItemPurchase> items) {
        List<String> data = new ArrayList<>();
        data.add(felt(adventurerId));
        data.add(felt(potions));
        data.add(felt(items.size()));
        for (ItemPurchase item : items) {
            data.add(felt(item.getItemId()));
            data.add(bool(item.isEquip()));
        }
        return new ContractCall(gameContract, BUY_ITEMS, data);
    }

    public ContractCall equip(long adventurerId, List<Integer> itemIds) {
        List<String> data = new ArrayList<>();
        data.add(felt(adventurerId));
        data.add(felt(itemIds.size()));
        for (int id : itemIds) {
            data.add(felt(id));
        }
        return new ContractCall(gameContract, EQUIP, data);
    }

    public ContractCall selectStatUpgrades(long adventurerId, StatAllocation allocation) {
        List<String> data = new ArrayList<>();
        data.add(felt(adventurerId));
        for (StatType stat : STAT_ORDER) {
            data.add(felt(allocation.get(stat)));
        }
        return new ContractCall(gameContract, SELECT_STAT_UPGRADES, data);
    }

    /**
     * Randomness request without the trailing salt felt; the signer appends the
     * Poseidon hash of the salt elements.
     */
    public ContractCall requestRandom(String vrfProvider) {
        List<String> data = new ArrayList<>();
        data.add(gameContract);
        data.add(SOURCE_SALT);
        return new ContractCall(vrfProvider, REQUEST_RANDOM, data);
    }

    private ContractCall call(String entrypoint, String... calldata) {
        List<String> data = new ArrayList<>(calldata.length);
        for (String value : calldata) {
            data.add(value);
        }
        return new ContractCall(gameContract, entrypoint, data);
    }

    static String felt(long value) {
        return Long.toString(value);
    }

    static String bool(boolean value) {
        return value ? "1" : "0";
    }
}
