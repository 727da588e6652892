package com.vigil.combat;

import com.vigil.data.DamageType;
import com.vigil.data.ItemCatalog;
import com.vigil.data.ItemMeta;
import com.vigil.data.ItemSlot;
import com.vigil.state.Beast;
import com.vigil.state.DerivedState;
import com.vigil.state.Equipment;
import com.vigil.state.Item;
import com.vigil.state.Stats;

/**
 * Replicates the contract's damage formulas closely enough to weigh fighting
 * against fleeing. Stateless.
 */
public final class CombatEstimator {

    /**
     * Power used when no weapon is equipped.
     */
    static final int UNARMED_POWER = 1;

    private CombatEstimator() {
    }

    public static CombatEstimate estimate(DerivedState state, ItemCatalog catalog) {
        return estimate(state.getBeast(), state.getStats(), state.getEquipment(), catalog);
    }

    /**
     * Estimate the fight with an arbitrary loadout, used to simulate swaps.
     */
    public static CombatEstimate estimate(Beast beast, Stats stats, Equipment equipment, ItemCatalog catalog) {
        int hit = hitDamage(beast, stats, equipment, catalog);

        int total = 0;
        int max = 0;
        for (ItemSlot slot : ItemSlot.ARMOR) {
            int damage = incomingDamage(beast, slot, equipment, catalog);
            total += damage;
            max = Math.max(max, damage);
        }
        double incoming = total / (double) ItemSlot.ARMOR.size();

        int turns = turnsToKill(beast.getHealth(), hit);
        double fightDamage = incoming * Math.max(0, turns - 1);
        return new CombatEstimate(hit, incoming, max, turns, fightDamage);
    }

    static int turnsToKill(int beastHealth, int hitDamage) {
        if (beastHealth <= 0) {
            return 0;
        }
        return (beastHealth + hitDamage - 1) / Math.max(1, hitDamage);
    }

    /**
     * Weapon power times elemental multiplier, scaled by strength and expected
     * critical hits, minus beast armor.
     */
    static int hitDamage(Beast beast, Stats stats, Equipment equipment, ItemCatalog catalog) {
        Item weapon = equipment.get(ItemSlot.WEAPON);
        int power = UNARMED_POWER;
        DamageType attackType = DamageType.NONE;
        if (weapon != null) {
            ItemMeta meta = catalog.get(weapon.getId());
            power = CombatMath.itemPower(weapon.getXp(), meta != null ? meta.getTier() : 0);
            if (meta != null) {
                attackType = meta.getDamageType();
            }
        }

        double damage = power * CombatMath.elementalMultiplier(attackType, CombatMath.beastArmorType(beast.getId()));
        damage *= 1.0 + CombatMath.STRENGTH_BONUS_PER_POINT * Math.max(0, stats.getStrength());
        double critChance = Math.min(1.0, Math.max(0, stats.getLuck()) / 100.0);
        damage *= 1.0 + critChance * CombatMath.CRITICAL_HIT_BONUS;

        int armor = CombatMath.beastPower(beast.getId(), beast.getLevel());
        return Math.max(CombatMath.MIN_DAMAGE_TO_BEASTS, (int) Math.floor(damage - armor));
    }

    /**
     * Beast damage landing on one armor slot. An empty slot takes the strong multiplier.
     */
    static int incomingDamage(Beast beast, ItemSlot slot, Equipment equipment, ItemCatalog catalog) {
        int attack = CombatMath.beastPower(beast.getId(), beast.getLevel());
        Item armor = equipment.get(slot);
        if (armor == null) {
            return Math.max(CombatMath.MIN_DAMAGE_FROM_BEASTS,
                    (int) Math.floor(attack * CombatMath.STRONG_MULTIPLIER));
        }

        ItemMeta meta = catalog.get(armor.getId());
        DamageType armorType = meta != null ? meta.getDamageType() : DamageType.NONE;
        double armorPower = CombatMath.itemPower(armor.getXp(), meta != null ? meta.getTier() : 0);
        armorPower += armorPower * neckBonus(equipment, armorType);

        double damage = attack * CombatMath.elementalMultiplier(CombatMath.beastAttackType(beast.getId()), armorType)
                - armorPower;
        return Math.max(CombatMath.MIN_DAMAGE_FROM_BEASTS, (int) Math.floor(damage));
    }

    /**
     * Fractional armor bonus from a neck item matching the armor's material.
     */
    static double neckBonus(Equipment equipment, DamageType armorType) {
        Item neck = equipment.get(ItemSlot.NECK);
        if (neck == null || armorType == DamageType.NONE || CombatMath.neckArmorType(neck.getId()) != armorType) {
            return 0;
        }
        return CombatMath.greatness(neck.getXp()) * CombatMath.NECK_ARMOR_BONUS_PER_GREATNESS;
    }
}
