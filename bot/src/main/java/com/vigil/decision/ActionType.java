package com.vigil.decision;

/**
 * The fixed set of things the agent can do in one iteration. Every type except
 * {@link #WAIT} maps to exactly one game transaction.
 */
public enum ActionType {
    START_GAME,
    EXPLORE,
    ATTACK,
    FLEE,
    BUY_POTIONS,
    BUY_ITEMS,
    EQUIP,
    SELECT_STATS,
    WAIT;

    public boolean isWrite() {
        return this != WAIT;
    }

    public boolean isMarketAction() {
        return this == BUY_POTIONS || this == BUY_ITEMS;
    }
}
