package com.vigil.decision;

import com.vigil.config.PolicyConfig;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.DerivedState;
import com.vigil.state.Item;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses bag items to equip outside combat: the best candidate per slot, equipped
 * when it beats the current item by the upgrade margin. Armor may also take a small
 * immediate loss for a strictly better tier whose long-run score is higher.
 */
public final class EquipPlanner {

    private EquipPlanner() {
    }

    public static Optional<Action> plan(DerivedState state, PolicyConfig policy, ItemCatalog catalog) {
        if (state.getBagItems().isEmpty()) {
            return Optional.empty();
        }
        ItemScorer scorer = new ItemScorer(policy, catalog, state.getLevel(), state.getEquipment());

        Map<ItemSlot, Item> bestBySlot = new EnumMap<>(ItemSlot.class);
        for (Item item : state.getBagItems()) {
            ItemMeta meta = catalog.get(item.getId());
            if (meta == null || meta.getSlot() == ItemSlot.NONE) {
                continue;
            }
            Item best = bestBySlot.get(meta.getSlot());
            if (best == null || scorer.longRunScore(item) > scorer.longRunScore(best)) {
                bestBySlot.put(meta.getSlot(), item);
            }
        }

        List<Integer> toEquip = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        for (Map.Entry<ItemSlot, Item> entry : bestBySlot.entrySet()) {
            ItemSlot slot = entry.getKey();
            Item candidate = entry.getValue();
            Item current = state.getEquipment().get(slot);
            String slotName = slot.name().toLowerCase(Locale.ROOT);

            if (current == null || catalog.get(current.getId()) == null) {
                toEquip.add(candidate.getId());
                reasons.add("fill " + slotName);
            } else if (isUpgrade(scorer, policy, candidate, current)) {
                toEquip.add(candidate.getId());
                reasons.add("upgrade " + slotName);
            } else if (slot.isArmor() && isTierTrade(scorer, policy, catalog, candidate, current)) {
                toEquip.add(candidate.getId());
                reasons.add("better tier " + slotName);
            }
        }

        if (toEquip.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Action.of(ActionType.EQUIP, "equip " + String.join(", ", reasons), new EquipOrder(toEquip)));
    }

    static boolean isUpgrade(ItemScorer scorer, PolicyConfig policy, Item candidate, Item current) {
        return scorer.longRunScore(candidate) > scorer.longRunScore(current) * (1.0 + policy.getEquipUpgradeThreshold());
    }

    static boolean isTierTrade(ItemScorer scorer, PolicyConfig policy, ItemCatalog catalog, Item candidate, Item current) {
        ItemMeta candidateMeta = catalog.get(candidate.getId());
        ItemMeta currentMeta = catalog.get(current.getId());
        if (candidateMeta == null || currentMeta == null
                || !candidateMeta.hasKnownTier() || !currentMeta.hasKnownTier()
                || candidateMeta.getTier() >= currentMeta.getTier()) {
            return false;
        }
        boolean smallLoss = scorer.score(candidate) >= scorer.score(current) * (1.0 - policy.getArmorDowngradeTolerance());
        return smallLoss && scorer.longRunScore(candidate) > scorer.longRunScore(current);
    }
}
