package com.vigil.state;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Game-meaningful snapshot of one adventurer, derived fresh from a raw chain
 * snapshot on every iteration. Never mutated; the next read replaces it.
 *
 * <p>Instances are produced by {@link StateDeriver}. {@code actionCount} is the only
 * reliable signal that a submitted write has settled.
 */
@Value
@Builder(toBuilder = true)
public class DerivedState {

    long adventurerId;

    // ========================================================================
    // Vitals
    // ========================================================================

    int hp;

    /**
     * {@code hpBase + hpPerVitality * vitality}.
     */
    int maxHp;

    /**
     * {@code hp / maxHp}, or 1 when maxHp is 0. Not clamped: reflects the source.
     */
    double hpPct;

    int xp;

    /**
     * Derived from xp with the contract's formula.
     */
    int level;

    int gold;

    /**
     * Strictly increasing per settled write.
     */
    long actionCount;

    // ========================================================================
    // Stats
    // ========================================================================

    @Builder.Default
    Stats stats = Stats.ZERO;

    /**
     * Unspent stat allocation points.
     */
    int statUpgrades;

    // ========================================================================
    // Combat
    // ========================================================================

    @Builder.Default
    Beast beast = Beast.NONE;

    boolean inCombat;

    double fleeChance;

    double avoidObstacleChance;

    double avoidAmbushChance;

    // ========================================================================
    // Inventory
    // ========================================================================

    @Builder.Default
    List<Item> bagItems = Collections.emptyList();

    @Builder.Default
    Equipment equipment = Equipment.EMPTY;

    /**
     * Purchasable item ids; empty when the market is closed.
     */
    @Builder.Default
    List<Integer> market = Collections.emptyList();

    // ========================================================================
    // Lifecycle helpers
    // ========================================================================

    /**
     * An adventurer with no health and no experience has never started.
     */
    public boolean isNotStarted() {
        return hp <= 0 && xp <= 0;
    }

    /**
     * An adventurer with no health but some experience died; the run cannot be resumed.
     */
    public boolean isTerminated() {
        return hp <= 0 && xp > 0;
    }

    public boolean isMarketOpen() {
        return !market.isEmpty();
    }

    /**
     * Ids of every item the decision engine may need metadata for:
     * equipped, in the bag, and for sale.
     */
    public List<Integer> referencedItemIds() {
        List<Integer> ids = new ArrayList<>();
        for (Item item : equipment.getSlots().values()) {
            ids.add(item.getId());
        }
        for (Item item : bagItems) {
            ids.add(item.getId());
        }
        ids.addAll(market);
        return ids;
    }
}
