package com.vigil.combat;

import com.vigil.data.DamageType;
import org.junit.Test;

import static org.junit.Assert.*;

public class CombatMathTest {

    // ========================================================================
    // Items
    // ========================================================================

    @Test
    public void testTierMultiplier_BestTierHitsHardest() {
        assertEquals(5, CombatMath.tierMultiplier(1));
        assertEquals(3, CombatMath.tierMultiplier(3));
        assertEquals(1, CombatMath.tierMultiplier(5));
        assertEquals(1, CombatMath.tierMultiplier(0));
        assertEquals(1, CombatMath.tierMultiplier(9));
    }

    @Test
    public void testGreatness_SquareRootCapped() {
        assertEquals(1, CombatMath.greatness(0));
        assertEquals(1, CombatMath.greatness(3));
        assertEquals(4, CombatMath.greatness(16));
        assertEquals(20, CombatMath.greatness(400));
        assertEquals(20, CombatMath.greatness(10_000));
    }

    @Test
    public void testItemPowerAndCeiling() {
        assertEquals(40, CombatMath.itemPower(100, 2));
        assertEquals(100, CombatMath.itemCeiling(1));
        assertEquals(20, CombatMath.itemCeiling(5));
    }

    @Test
    public void testElementalMultiplier_Triangle() {
        assertEquals(1.5, CombatMath.elementalMultiplier(DamageType.MAGIC, DamageType.METAL), 0.0);
        assertEquals(0.5, CombatMath.elementalMultiplier(DamageType.MAGIC, DamageType.HIDE), 0.0);
        assertEquals(1.5, CombatMath.elementalMultiplier(DamageType.BLADE, DamageType.CLOTH), 0.0);
        assertEquals(0.5, CombatMath.elementalMultiplier(DamageType.BLADE, DamageType.METAL), 0.0);
        assertEquals(1.5, CombatMath.elementalMultiplier(DamageType.BLUDGEON, DamageType.HIDE), 0.0);
        assertEquals(1.0, CombatMath.elementalMultiplier(DamageType.MAGIC, DamageType.CLOTH), 0.0);
        assertEquals(1.0, CombatMath.elementalMultiplier(DamageType.NONE, DamageType.METAL), 0.0);
        assertEquals(1.0, CombatMath.elementalMultiplier(DamageType.BLADE, DamageType.NONE), 0.0);
    }

    // ========================================================================
    // Beasts
    // ========================================================================

    @Test
    public void testBeastTier_FiveIdsPerTierWithinFamily() {
        assertEquals(1, CombatMath.beastTier(1));
        assertEquals(1, CombatMath.beastTier(5));
        assertEquals(2, CombatMath.beastTier(6));
        assertEquals(5, CombatMath.beastTier(25));
        assertEquals(1, CombatMath.beastTier(26));
        assertEquals(5, CombatMath.beastTier(75));
    }

    @Test
    public void testBeastTier_UnknownIdsAreMidTier() {
        assertEquals(CombatMath.UNKNOWN_BEAST_TIER, CombatMath.beastTier(0));
        assertEquals(CombatMath.UNKNOWN_BEAST_TIER, CombatMath.beastTier(76));
        assertEquals(DamageType.NONE, CombatMath.beastAttackType(0));
        assertEquals(DamageType.NONE, CombatMath.beastArmorType(76));
    }

    @Test
    public void testBeastFamilies() {
        assertEquals(DamageType.MAGIC, CombatMath.beastAttackType(1));
        assertEquals(DamageType.CLOTH, CombatMath.beastArmorType(1));
        assertEquals(DamageType.BLADE, CombatMath.beastAttackType(26));
        assertEquals(DamageType.HIDE, CombatMath.beastArmorType(26));
        assertEquals(DamageType.BLUDGEON, CombatMath.beastAttackType(51));
        assertEquals(DamageType.METAL, CombatMath.beastArmorType(51));
    }

    @Test
    public void testBeastPower_LevelTimesTier() {
        assertEquals(50, CombatMath.beastPower(1, 10));
        assertEquals(3, CombatMath.beastPower(0, 0));
        assertEquals(30, CombatMath.beastPower(0, 10));
    }

    // ========================================================================
    // Jewelry and prices
    // ========================================================================

    @Test
    public void testNeckItems_MapBothWays() {
        assertEquals(DamageType.CLOTH, CombatMath.neckArmorType(CombatMath.AMULET));
        assertEquals(DamageType.HIDE, CombatMath.neckArmorType(CombatMath.PENDANT));
        assertEquals(DamageType.METAL, CombatMath.neckArmorType(CombatMath.NECKLACE));
        assertEquals(DamageType.NONE, CombatMath.neckArmorType(12));
        assertEquals(CombatMath.NECKLACE, CombatMath.neckItemFor(DamageType.METAL));
        assertEquals(0, CombatMath.neckItemFor(DamageType.NONE));
    }

    @Test
    public void testPrices_CharismaDiscountWithFloor() {
        assertEquals(6, CombatMath.potionPrice(10, 2));
        assertEquals(1, CombatMath.potionPrice(3, 5));
        assertEquals(20, CombatMath.itemPrice(1, 0));
        assertEquals(1, CombatMath.itemPrice(5, 10));
    }

    @Test
    public void testCharismaForPotionFloor() {
        assertEquals(0, CombatMath.charismaForPotionFloor(1));
        assertEquals(1, CombatMath.charismaForPotionFloor(2));
        assertEquals(5, CombatMath.charismaForPotionFloor(10));
        assertEquals(1, CombatMath.potionPrice(10, CombatMath.charismaForPotionFloor(10)));
        assertTrue(CombatMath.potionPrice(10, CombatMath.charismaForPotionFloor(10) - 1) > 1);
    }
}
