package com.vigil.decision;

import com.vigil.combat.CombatMath;
import com.vigil.config.PolicyConfig;
import com.vigil.data.DamageType;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.Equipment;
import com.vigil.state.Item;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scores owned or purchasable items for one slot so candidates can be compared.
 *
 * <ul>
 *   <li>Rings: greatness (which drives luck), with a bonus for the preferred ring.</li>
 *   <li>Neck items: greatness, doubled when the item amplifies the dominant armor material.</li>
 *   <li>Everything else: {@code greatness * tierMultiplier}, and a long-run variant that
 *       credits part of the remaining growth to maximum greatness as the run gets longer.</li>
 * </ul>
 */
public final class ItemScorer {

    private final PolicyConfig policy;
    private final ItemCatalog catalog;
    private final int level;
    private final DamageType dominantArmor;

    public ItemScorer(PolicyConfig policy, ItemCatalog catalog, int level, Equipment equipment) {
        this.policy = policy;
        this.catalog = catalog;
        this.level = level;
        this.dominantArmor = dominantArmorType(equipment, catalog);
    }

    public DamageType getDominantArmor() {
        return dominantArmor;
    }

    /**
     * Current value of the item in its slot.
     */
    public double score(Item item) {
        ItemMeta meta = catalog.get(item.getId());
        if (meta == null) {
            return 0;
        }
        int greatness = CombatMath.greatness(item.getXp());
        switch (meta.getSlot()) {
            case RING:
                return greatness * (item.getId() == policy.getPreferredRingId() ? policy.getPreferredRingBonus() : 1.0);
            case NECK:
                return greatness * (CombatMath.neckArmorType(item.getId()) == dominantArmor ? 2.0 : 1.0);
            default:
                return CombatMath.itemPower(item.getXp(), meta.getTier());
        }
    }

    /**
     * Score biased toward items with a higher ceiling. The bias grows with level until
     * the configured horizon. Jewelry is scored the same as {@link #score(Item)}.
     */
    public double longRunScore(Item item) {
        ItemMeta meta = catalog.get(item.getId());
        if (meta == null || meta.getSlot().isJewelry()) {
            return score(item);
        }
        double current = CombatMath.itemPower(item.getXp(), meta.getTier());
        double ceiling = CombatMath.itemCeiling(meta.getTier());
        return current + potentialBias() * (ceiling - current);
    }

    double potentialBias() {
        double progress = Math.min(1.0, Math.max(0, level) / (double) Math.max(1, policy.getPotentialHorizonLevel()));
        return policy.getPotentialBiasWeight() * progress;
    }

    /**
     * Most common material among equipped armor, or NONE when nothing known is equipped.
     */
    static DamageType dominantArmorType(Equipment equipment, ItemCatalog catalog) {
        Map<DamageType, Integer> counts = new EnumMap<>(DamageType.class);
        for (ItemSlot slot : ItemSlot.ARMOR) {
            Item item = equipment.get(slot);
            ItemMeta meta = item != null ? catalog.get(item.getId()) : null;
            if (meta != null && meta.getDamageType().isArmorType()) {
                counts.merge(meta.getDamageType(), 1, Integer::sum);
            }
        }
        DamageType best = DamageType.NONE;
        int bestCount = 0;
        for (Map.Entry<DamageType, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
