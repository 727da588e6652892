package com.vigil.combat;

import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.DerivedState;
import com.vigil.state.Equipment;
import com.vigil.state.Item;
import lombok.Value;

import java.util.Optional;

/**
 * Simulates swapping each bag item into its slot during a fight.
 *
 * <p>Equipping mid-combat gives the beast one free hit, so a swap is only worth it
 * when the saving covers that extra turn by a material margin.
 */
public final class LoadoutOptimizer {

    private LoadoutOptimizer() {
    }

    @Value
    public static class Swap {
        Item item;
        ItemSlot slot;
        CombatEstimate before;
        CombatEstimate after;

        /**
         * Expected damage with the swap, including the free beast hit.
         */
        public double costWithSwap() {
            return after.getIncomingPerHit() + after.getExpectedFightDamage();
        }

        public double reduction() {
            double current = before.getExpectedFightDamage();
            if (current <= 0) {
                return 0;
            }
            return (current - costWithSwap()) / current;
        }
    }

    /**
     * @param minReduction fraction of the current expected fight damage the swap must save
     * @return the best swap, or empty when none clears the margin or any would risk a one-hit kill
     */
    public static Optional<Swap> bestSwap(DerivedState state, ItemCatalog catalog, double minReduction) {
        if (!state.isInCombat() || state.getBagItems().isEmpty()) {
            return Optional.empty();
        }

        CombatEstimate before = CombatEstimator.estimate(state, catalog);
        Swap best = null;
        for (Item item : state.getBagItems()) {
            ItemMeta meta = catalog.get(item.getId());
            if (meta == null || !(meta.getSlot() == ItemSlot.WEAPON || meta.getSlot().isArmor()
                    || meta.getSlot() == ItemSlot.NECK)) {
                continue;
            }

            Equipment trial = state.getEquipment().with(meta.getSlot(), item);
            CombatEstimate after = CombatEstimator.estimate(state.getBeast(), state.getStats(), trial, catalog);
            if (after.isOneHitKillRisk(state.getHp())) {
                continue;
            }

            Swap swap = new Swap(item, meta.getSlot(), before, after);
            if (swap.reduction() < minReduction) {
                continue;
            }
            if (best == null || swap.costWithSwap() < best.costWithSwap()) {
                best = swap;
            }
        }
        return Optional.ofNullable(best);
    }
}
