package com.vigil.chain;

import com.vigil.decision.ItemPurchase;
import com.vigil.decision.StatAllocation;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Write side of the game. Each call is exactly one transaction attempt. Failures
 * are classified before they are thrown, so callers switch on
 * {@link WriteException#getKind()} and never on the message text.
 */
public interface GameWriter {

    SettlementHandle startGame(long adventurerId, int weaponId) throws WriteException;

    SettlementHandle explore(long adventurerId, boolean tillBeast, @Nullable RandomnessSalt salt) throws WriteException;

    SettlementHandle attack(long adventurerId, boolean toTheDeath, @Nullable RandomnessSalt salt) throws WriteException;

    SettlementHandle flee(long adventurerId, boolean toTheDeath, @Nullable RandomnessSalt salt) throws WriteException;

    SettlementHandle buyItems(long adventurerId, List<ItemPurchase> items, int potions) throws WriteException;

    SettlementHandle buyPotions(long adventurerId, int count) throws WriteException;

    SettlementHandle equip(long adventurerId, List<Integer> itemIds, @Nullable RandomnessSalt salt) throws WriteException;

    SettlementHandle selectStatUpgrades(long adventurerId, StatAllocation allocation) throws WriteException;

    /**
     * Ask the signer layer to refresh its connection. Used for light desync recovery.
     */
    void resync();
}
