package com.vigil.decision;

import com.vigil.combat.CombatMath;
import com.vigil.config.PolicyConfig;
import com.vigil.state.DerivedState;
import com.vigil.state.StatType;
import com.vigil.state.Stats;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy stat allocation.
 *
 * <p>Each point goes to the first stat still below its target, in this order:
 * <ol>
 *   <li>charisma, up to the amount that puts potions at the floor price (capped)</li>
 *   <li>dexterity, vitality, charisma and strength, with targets proportional to level</li>
 *   <li>intelligence and wisdom, whose targets grow once past the mid-game level and
 *       which move ahead of strength from then on</li>
 * </ol>
 * When every target is met, points follow the configured priority order round-robin.
 * Luck cannot be allocated; it comes from jewelry.
 */
public final class StatAllocator {

    private StatAllocator() {
    }

    public static StatAllocation allocate(DerivedState state, PolicyConfig policy) {
        int level = Math.max(1, state.getLevel());
        Stats stats = state.getStats();
        Map<StatType, Integer> added = new EnumMap<>(StatType.class);
        for (StatType stat : StatType.values()) {
            added.put(stat, 0);
        }

        List<Target> targets = targets(level, policy);
        List<StatType> fallback = fallbackOrder(policy);

        int remaining = Math.max(0, state.getStatUpgrades());
        int fallbackIndex = 0;
        while (remaining > 0) {
            StatType pick = null;
            for (Target target : targets) {
                if (stats.get(target.stat) + added.get(target.stat) < target.value) {
                    pick = target.stat;
                    break;
                }
            }
            if (pick == null) {
                pick = fallback.get(fallbackIndex % fallback.size());
                fallbackIndex++;
            }
            added.merge(pick, 1, Integer::sum);
            remaining--;
        }
        return new StatAllocation(added);
    }

    static List<Target> targets(int level, PolicyConfig policy) {
        boolean lateGame = level >= policy.getMidGameLevel();
        double intWisWeight = lateGame ? policy.getLateIntWisWeight() : 1.0;

        List<Target> targets = new ArrayList<>();
        targets.add(new Target(StatType.CHARISMA,
                Math.min(policy.getPotionCharismaCap(), CombatMath.charismaForPotionFloor(level))));
        targets.add(new Target(StatType.DEXTERITY, ceil(level * policy.getDexTargetRatio())));
        targets.add(new Target(StatType.VITALITY, ceil(level * policy.getVitTargetRatio())));
        targets.add(new Target(StatType.CHARISMA, ceil(level * policy.getChaTargetRatio())));

        Target strength = new Target(StatType.STRENGTH, ceil(level * policy.getStrTargetRatio()));
        Target intelligence = new Target(StatType.INTELLIGENCE, ceil(level * policy.getIntTargetRatio() * intWisWeight));
        Target wisdom = new Target(StatType.WISDOM, ceil(level * policy.getWisTargetRatio() * intWisWeight));
        if (lateGame) {
            targets.add(intelligence);
            targets.add(wisdom);
            targets.add(strength);
        } else {
            targets.add(strength);
            targets.add(intelligence);
            targets.add(wisdom);
        }
        return targets;
    }

    private static List<StatType> fallbackOrder(PolicyConfig policy) {
        List<StatType> order = new ArrayList<>();
        for (StatType stat : policy.getStatUpgradePriority()) {
            order.add(stat == StatType.LUCK ? StatType.VITALITY : stat);
        }
        if (order.isEmpty()) {
            order.add(StatType.VITALITY);
        }
        return order;
    }

    private static int ceil(double value) {
        return (int) Math.ceil(value);
    }

    static final class Target {
        final StatType stat;
        final int value;

        Target(StatType stat, int value) {
            this.stat = stat;
            this.value = value;
        }
    }
}
