package com.vigil.runner;

import com.vigil.chain.GameWriter;
import com.vigil.chain.RandomnessSalt;
import com.vigil.chain.SettlementHandle;
import com.vigil.chain.WriteErrorKind;
import com.vigil.chain.WriteException;
import com.vigil.decision.Action;
import com.vigil.decision.ActionPayload;
import com.vigil.decision.EquipOrder;
import com.vigil.decision.ExplorePayload;
import com.vigil.decision.PotionPurchase;
import com.vigil.decision.PurchaseOrder;
import com.vigil.decision.StartGamePayload;
import com.vigil.decision.StatAllocation;
import com.vigil.state.DerivedState;

/**
 * Maps a decided action onto exactly one writer call, attaching the randomness
 * salt for actions that draw randomness.
 */
public final class ActionDispatcher {

    private ActionDispatcher() {
    }

    public static SettlementHandle dispatch(Action action, DerivedState state, GameWriter writer)
            throws WriteException {
        long id = state.getAdventurerId();
        switch (action.getType()) {
            case START_GAME:
                return writer.startGame(id, require(action, StartGamePayload.class).getWeaponId());
            case EXPLORE:
                return writer.explore(id, require(action, ExplorePayload.class).isTillBeast(),
                        RandomnessSalt.explore(state.getXp(), id));
            case ATTACK:
                return writer.attack(id, false, battleSalt(state));
            case FLEE:
                return writer.flee(id, false, battleSalt(state));
            case BUY_POTIONS:
                return writer.buyPotions(id, require(action, PotionPurchase.class).getCount());
            case BUY_ITEMS:
                PurchaseOrder order = require(action, PurchaseOrder.class);
                return writer.buyItems(id, order.getItems(), order.getPotions());
            case EQUIP:
                return writer.equip(id, require(action, EquipOrder.class).getItemIds(),
                        state.isInCombat() ? battleSalt(state) : null);
            case SELECT_STATS:
                return writer.selectStatUpgrades(id, require(action, StatAllocation.class));
            default:
                throw new WriteException(WriteErrorKind.UNCLASSIFIED, action.getType() + " is not a write");
        }
    }

    static RandomnessSalt battleSalt(DerivedState state) {
        return RandomnessSalt.battle(state.getXp(), state.getAdventurerId(), state.getActionCount());
    }

    private static <T extends ActionPayload> T require(Action action, Class<T> type) throws WriteException {
        return action.payload(type).orElseThrow(() -> new WriteException(WriteErrorKind.UNCLASSIFIED,
                action.getType() + " is missing its " + type.getSimpleName()));
    }
}
