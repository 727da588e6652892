package com.vigil.combat;

import com.vigil.data.DamageType;

/**
 * Fixed formulas of the game contract: tier multipliers, the greatness curve,
 * damage floors, the elemental effectiveness table, beast classification and
 * market prices.
 *
 * <p>These are local approximations used for planning. Onchain settlement is
 * authoritative.
 */
public final class CombatMath {

    public static final int MAX_GREATNESS = 20;
    public static final int MIN_DAMAGE_TO_BEASTS = 4;
    public static final int MIN_DAMAGE_FROM_BEASTS = 2;

    public static final double STRONG_MULTIPLIER = 1.5;
    public static final double FAIR_MULTIPLIER = 1.0;
    public static final double WEAK_MULTIPLIER = 0.5;

    public static final double STRENGTH_BONUS_PER_POINT = 0.10;
    public static final double CRITICAL_HIT_BONUS = 1.0;

    public static final double NECK_ARMOR_BONUS_PER_GREATNESS = 0.03;

    public static final int POTION_HEAL = 10;
    public static final int POTION_CHARISMA_DISCOUNT = 2;
    public static final int ITEM_BASE_PRICE = 4;
    public static final int ITEM_CHARISMA_DISCOUNT = 1;
    public static final int MIN_PRICE = 1;

    public static final int BEASTS_PER_FAMILY = 25;
    public static final int MAX_BEAST_ID = 75;

    /**
     * Tier assumed for beasts whose id falls outside the known families.
     */
    public static final int UNKNOWN_BEAST_TIER = 3;

    // Jewelry ids from the loot table
    public static final int PENDANT = 1;
    public static final int NECKLACE = 2;
    public static final int AMULET = 3;

    private CombatMath() {
    }

    // ========================================================================
    // Items
    // ========================================================================

    /**
     * {@code 6 - tier} for tiers 1..5. Unknown tiers count as the worst tier.
     */
    public static int tierMultiplier(int tier) {
        if (tier < 1 || tier > 5) {
            return 1;
        }
        return 6 - tier;
    }

    /**
     * Greatness grows with the square root of item experience, from 1 up to {@value #MAX_GREATNESS}.
     */
    public static int greatness(int xp) {
        if (xp <= 0) {
            return 1;
        }
        return Math.min(MAX_GREATNESS, Math.max(1, (int) Math.floor(Math.sqrt(xp))));
    }

    /**
     * Effective power of an item: greatness times tier multiplier.
     */
    public static int itemPower(int xp, int tier) {
        return greatness(xp) * tierMultiplier(tier);
    }

    /**
     * Power the item reaches at maximum greatness.
     */
    public static int itemCeiling(int tier) {
        return MAX_GREATNESS * tierMultiplier(tier);
    }

    // ========================================================================
    // Elemental effectiveness
    // ========================================================================

    /**
     * Magic beats Metal, Blade beats Cloth, Bludgeon beats Hide; the reverse
     * pairings are weak; everything else is fair.
     */
    public static double elementalMultiplier(DamageType attack, DamageType armor) {
        if (attack == null || armor == null || !attack.isAttackType() || !armor.isArmorType()) {
            return FAIR_MULTIPLIER;
        }
        switch (attack) {
            case MAGIC:
                return armor == DamageType.METAL ? STRONG_MULTIPLIER
                        : armor == DamageType.HIDE ? WEAK_MULTIPLIER : FAIR_MULTIPLIER;
            case BLADE:
                return armor == DamageType.CLOTH ? STRONG_MULTIPLIER
                        : armor == DamageType.METAL ? WEAK_MULTIPLIER : FAIR_MULTIPLIER;
            case BLUDGEON:
                return armor == DamageType.HIDE ? STRONG_MULTIPLIER
                        : armor == DamageType.CLOTH ? WEAK_MULTIPLIER : FAIR_MULTIPLIER;
            default:
                return FAIR_MULTIPLIER;
        }
    }

    // ========================================================================
    // Beasts
    // ========================================================================

    /**
     * Beasts come in three families of 25 ids; within a family every five ids share a tier.
     */
    public static int beastTier(int beastId) {
        if (beastId < 1 || beastId > MAX_BEAST_ID) {
            return UNKNOWN_BEAST_TIER;
        }
        int offset = (beastId - 1) % BEASTS_PER_FAMILY;
        return offset / 5 + 1;
    }

    public static DamageType beastAttackType(int beastId) {
        switch (beastFamily(beastId)) {
            case 0:
                return DamageType.MAGIC;
            case 1:
                return DamageType.BLADE;
            case 2:
                return DamageType.BLUDGEON;
            default:
                return DamageType.NONE;
        }
    }

    public static DamageType beastArmorType(int beastId) {
        switch (beastFamily(beastId)) {
            case 0:
                return DamageType.CLOTH;
            case 1:
                return DamageType.HIDE;
            case 2:
                return DamageType.METAL;
            default:
                return DamageType.NONE;
        }
    }

    /**
     * Beast attack and armor both scale as {@code level * (6 - tier)}.
     */
    public static int beastPower(int beastId, int beastLevel) {
        return Math.max(1, beastLevel) * tierMultiplier(beastTier(beastId));
    }

    private static int beastFamily(int beastId) {
        if (beastId < 1 || beastId > MAX_BEAST_ID) {
            return -1;
        }
        return (beastId - 1) / BEASTS_PER_FAMILY;
    }

    // ========================================================================
    // Jewelry
    // ========================================================================

    /**
     * The armor type a neck item amplifies: Amulet for Cloth, Pendant for Hide,
     * Necklace for Metal.
     */
    public static DamageType neckArmorType(int neckItemId) {
        switch (neckItemId) {
            case AMULET:
                return DamageType.CLOTH;
            case PENDANT:
                return DamageType.HIDE;
            case NECKLACE:
                return DamageType.METAL;
            default:
                return DamageType.NONE;
        }
    }

    public static int neckItemFor(DamageType armorType) {
        switch (armorType) {
            case CLOTH:
                return AMULET;
            case HIDE:
                return PENDANT;
            case METAL:
                return NECKLACE;
            default:
                return 0;
        }
    }

    // ========================================================================
    // Market prices
    // ========================================================================

    public static int potionPrice(int level, int charisma) {
        return Math.max(MIN_PRICE, level - POTION_CHARISMA_DISCOUNT * Math.max(0, charisma));
    }

    public static int itemPrice(int tier, int charisma) {
        return Math.max(MIN_PRICE, tierMultiplier(tier) * ITEM_BASE_PRICE - ITEM_CHARISMA_DISCOUNT * Math.max(0, charisma));
    }

    /**
     * Charisma at which potions reach the floor price for the given level.
     */
    public static int charismaForPotionFloor(int level) {
        int needed = level - MIN_PRICE;
        if (needed <= 0) {
            return 0;
        }
        return (needed + POTION_CHARISMA_DISCOUNT - 1) / POTION_CHARISMA_DISCOUNT;
    }
}
