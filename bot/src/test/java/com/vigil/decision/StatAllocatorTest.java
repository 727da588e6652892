package com.vigil.decision;

import com.vigil.config.PolicyConfig;
import com.vigil.state.DerivedState;
import com.vigil.state.StatType;
import com.vigil.state.Stats;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.*;

public class StatAllocatorTest {

    private PolicyConfig policy;

    @Before
    public void setUp() {
        policy = new PolicyConfig();
    }

    private static DerivedState state(int level, int upgrades, Stats stats) {
        return DerivedState.builder()
                .hp(100).maxHp(100).hpPct(1.0)
                .xp(level * level).level(level)
                .statUpgrades(upgrades)
                .stats(stats)
                .build();
    }

    @Test
    public void testAllocate_DexterityFirstAtLevelOne() {
        StatAllocation allocation = StatAllocator.allocate(state(1, 1, Stats.ZERO), policy);

        assertEquals(1, allocation.get(StatType.DEXTERITY));
        assertEquals(1, allocation.total());
    }

    @Test
    public void testAllocate_CharismaUntilPotionsHitFloorPrice() {
        StatAllocation allocation = StatAllocator.allocate(state(10, 3, Stats.ZERO), policy);

        assertEquals(3, allocation.get(StatType.CHARISMA));
        assertEquals(3, allocation.total());
    }

    @Test
    public void testAllocate_FallsBackToPriorityRoundRobin() {
        Stats met = Stats.builder()
                .charisma(5).dexterity(10).vitality(7).strength(6).intelligence(5).wisdom(4)
                .build();
        StatAllocation allocation = StatAllocator.allocate(state(10, 4, met), policy);

        assertEquals(2, allocation.get(StatType.VITALITY));
        assertEquals(1, allocation.get(StatType.STRENGTH));
        assertEquals(1, allocation.get(StatType.DEXTERITY));
        assertEquals(4, allocation.total());
    }

    @Test
    public void testAllocate_LateGamePrefersIntelligenceOverStrength() {
        Stats stats = Stats.builder().charisma(6).dexterity(16).vitality(12).build();
        StatAllocation allocation = StatAllocator.allocate(state(16, 1, stats), policy);

        assertEquals(1, allocation.get(StatType.INTELLIGENCE));
        assertEquals(0, allocation.get(StatType.STRENGTH));
    }

    @Test
    public void testAllocate_EarlyGamePrefersStrength() {
        Stats stats = Stats.builder().charisma(5).dexterity(10).vitality(7).build();
        StatAllocation allocation = StatAllocator.allocate(state(10, 1, stats), policy);

        assertEquals(1, allocation.get(StatType.STRENGTH));
    }

    @Test
    public void testAllocate_LuckInPriorityGoesToVitality() {
        policy.setStatUpgradePriority(Collections.singletonList(StatType.LUCK));
        Stats met = Stats.builder()
                .charisma(1).dexterity(1).vitality(1).strength(1).intelligence(1).wisdom(1)
                .build();
        StatAllocation allocation = StatAllocator.allocate(state(1, 2, met), policy);

        assertEquals(2, allocation.get(StatType.VITALITY));
        assertEquals(0, allocation.get(StatType.LUCK));
    }

    @Test
    public void testAllocate_NoUpgradesAllocatesNothing() {
        StatAllocation allocation = StatAllocator.allocate(state(5, 0, Stats.ZERO), policy);

        assertEquals(0, allocation.total());
        assertEquals(StatType.values().length, allocation.getPoints().size());
    }
}
