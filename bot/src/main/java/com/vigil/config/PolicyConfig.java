package com.vigil.config;

import com.vigil.state.StatType;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Every threshold, ratio and target the decision engine uses. The engine itself
 * only hard-codes the contract's own formulas.
 */
@Data
public class PolicyConfig {

    // ========================================================================
    // Vitals
    // ========================================================================

    private int hpBase = 100;
    private int hpPerVitality = 15;
    private int targetLevel = 50;
    private int startingWeaponId = 12;

    // ========================================================================
    // Combat
    // ========================================================================

    /**
     * Flee when hp fraction drops below this and flee chance clears {@link #minFleeChance}.
     */
    private double fleeBelowHpPct = 0.35;
    private double minFleeChance = 0.75;

    /**
     * Below {@code fleeBelowHpPct * criticalHpRatio} flee regardless of flee chance.
     */
    private double criticalHpRatio = 0.7;

    private double maxBeastLevelRatio = 1.6;
    private double nearFullHpPct = 0.9;

    private int slowFightTurns = 7;
    private double slowFightMinFleeChance = 0.55;

    private double fightDamageHpRatio = 0.8;
    private double fightDamageMinFleeChance = 0.45;

    /**
     * Minimum fraction of expected fight damage a mid-combat equip must save.
     */
    private double midCombatEquipMinReduction = 0.2;

    // ========================================================================
    // Market
    // ========================================================================

    private double buyPotionIfBelowPct = 0.7;

    /**
     * Heal target used instead of {@link #buyPotionIfBelowPct} when potions cost the floor price.
     */
    private double cheapPotionHealTargetPct = 0.95;

    /**
     * Gold always withheld from gear purchases for future potions.
     */
    private int goldReserve = 12;

    private int earlyWeaponUpgradeMaxLevel = 8;
    private int earlyWeaponMinTierGain = 2;

    /**
     * Candidate base power must exceed current power by this fraction.
     */
    private double marketUpgradeMargin = 0.25;

    // ========================================================================
    // Equipment scoring
    // ========================================================================

    private double equipUpgradeThreshold = 0.12;

    /**
     * Immediate score loss accepted for a strictly better armor tier.
     */
    private double armorDowngradeTolerance = 0.1;

    /**
     * Level at which scoring fully favours an item's ceiling over its current power.
     */
    private int potentialHorizonLevel = 30;

    /**
     * Share of an item's remaining growth counted in its long-run score at the horizon.
     */
    private double potentialBiasWeight = 0.5;

    private int preferredRingId = 4;
    private double preferredRingBonus = 1.5;

    // ========================================================================
    // Stat allocation
    // ========================================================================

    /**
     * Charisma kept toward the potion floor price is capped at this value.
     */
    private int potionCharismaCap = 6;

    private double dexTargetRatio = 1.0;
    private double vitTargetRatio = 0.7;
    private double chaTargetRatio = 0.2;
    private double strTargetRatio = 0.6;
    private double intTargetRatio = 0.5;
    private double wisTargetRatio = 0.4;

    private int midGameLevel = 12;
    private double lateIntWisWeight = 1.5;

    private List<StatType> statUpgradePriority = new ArrayList<>(Arrays.asList(
            StatType.VITALITY, StatType.STRENGTH, StatType.DEXTERITY));

    // ========================================================================
    // Exploration
    // ========================================================================

    private double exploreTillBeastPct = 0.85;

    /**
     * From this level on, chained-hazard exploration is never requested.
     */
    private int tillBeastMaxLevel = 20;
}
