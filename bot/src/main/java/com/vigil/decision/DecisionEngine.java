package com.vigil.decision;

import com.vigil.combat.CombatEstimate;
import com.vigil.combat.CombatEstimator;
import com.vigil.combat.LoadoutOptimizer;
import com.vigil.config.PolicyConfig;
import com.vigil.data.ItemCatalog;
import com.vigil.state.DerivedState;

import javax.inject.Singleton;
import java.util.Collections;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns one {@link DerivedState} into one {@link Action}.
 *
 * <p>Pure: no I/O and no mutable state, so the same inputs always give the same
 * action. Branches are checked in priority order and the first that applies wins:
 * <ol>
 *   <li>not started: start a game</li>
 *   <li>terminated: wait</li>
 *   <li>in combat: flee, equip or attack</li>
 *   <li>unspent stat points: allocate them</li>
 *   <li>market open: potions, then gear</li>
 *   <li>better items in the bag: equip them</li>
 *   <li>otherwise explore</li>
 * </ol>
 */
@Singleton
public class DecisionEngine {

    public Action decide(DerivedState state, PolicyConfig policy, ItemCatalog catalog, DecisionOptions options) {
        if (state.isNotStarted()) {
            return Action.of(ActionType.START_GAME, "adventurer not started",
                    new StartGamePayload(policy.getStartingWeaponId()));
        }
        if (state.isTerminated()) {
            return Action.waitFor("adventurer terminated at level " + state.getLevel());
        }

        if (state.isInCombat()) {
            return decideCombat(state, policy, catalog, options);
        }

        if (state.getStatUpgrades() > 0 && options.isAllowStatSelection()) {
            return Action.of(ActionType.SELECT_STATS, "stat upgrades available: " + state.getStatUpgrades(),
                    StatAllocator.allocate(state, policy));
        }

        if (state.isMarketOpen() && options.isAllowMarket()) {
            MarketPlanner planner = new MarketPlanner(state, policy, catalog);
            Optional<Action> market = options.isAllowGearPurchase() ? planner.plan() : planner.planPotions();
            if (market.isPresent()) {
                return market.get();
            }
        }

        if (options.isConsiderEquip()) {
            Optional<Action> equip = EquipPlanner.plan(state, policy, catalog);
            if (equip.isPresent()) {
                return equip.get();
            }
        }

        boolean tillBeast = state.getHpPct() >= policy.getExploreTillBeastPct()
                && state.getLevel() < policy.getTillBeastMaxLevel();
        return Action.of(ActionType.EXPLORE,
                tillBeast ? "explore until next beast" : "explore one step",
                new ExplorePayload(tillBeast));
    }

    // ========================================================================
    // Combat
    // ========================================================================

    Action decideCombat(DerivedState state, PolicyConfig policy, ItemCatalog catalog, DecisionOptions options) {
        CombatEstimate estimate = CombatEstimator.estimate(state, catalog);
        Optional<String> fleeReason = fleeReason(state, policy, estimate);
        if (fleeReason.isPresent()) {
            return Action.of(ActionType.FLEE, fleeReason.get());
        }

        if (options.isConsiderEquip()) {
            Optional<LoadoutOptimizer.Swap> swap = LoadoutOptimizer.bestSwap(state, catalog,
                    policy.getMidCombatEquipMinReduction());
            if (swap.isPresent()) {
                LoadoutOptimizer.Swap s = swap.get();
                return Action.of(ActionType.EQUIP, String.format(Locale.ROOT,
                                "mid-combat swap %s cuts expected damage %.1f -> %.1f",
                                s.getSlot().name().toLowerCase(Locale.ROOT),
                                s.getBefore().getExpectedFightDamage(), s.costWithSwap()),
                        new EquipOrder(Collections.singletonList(s.getItem().getId())));
            }
        }

        return Action.of(ActionType.ATTACK, String.format(Locale.ROOT,
                "attack: %d turn(s) to kill, expected damage %.1f of hp %d",
                estimate.getTurnsToKill(), estimate.getExpectedFightDamage(), state.getHp()));
    }

    static Optional<String> fleeReason(DerivedState state, PolicyConfig policy, CombatEstimate estimate) {
        int level = Math.max(1, state.getLevel());
        double fleeChance = state.getFleeChance();
        double hpPct = state.getHpPct();

        if (state.getBeast().getLevel() > level * policy.getMaxBeastLevelRatio() && hpPct < policy.getNearFullHpPct()) {
            return Optional.of("beast level " + state.getBeast().getLevel() + " too high for level " + level);
        }

        if (estimate.getTurnsToKill() >= policy.getSlowFightTurns() && fleeChance >= policy.getSlowFightMinFleeChance()) {
            return Optional.of(String.format(Locale.ROOT, "slow fight: %d turns, flee chance %.2f",
                    estimate.getTurnsToKill(), fleeChance));
        }

        double fightDamage = estimate.getExpectedFightDamage();
        if (fightDamage > policy.getFightDamageHpRatio() * state.getHp()
                && fleeChance >= policy.getFightDamageMinFleeChance()
                && estimate.expectedFleeDamage(fleeChance) < fightDamage) {
            return Optional.of(String.format(Locale.ROOT, "expected fight damage %.1f vs hp %d, flee costs %.1f",
                    fightDamage, state.getHp(), estimate.expectedFleeDamage(fleeChance)));
        }

        if (hpPct < policy.getFleeBelowHpPct()) {
            boolean critical = hpPct < policy.getFleeBelowHpPct() * policy.getCriticalHpRatio();
            if (fleeChance >= policy.getMinFleeChance() || critical) {
                return Optional.of(String.format(Locale.ROOT, "hp %.2f below flee threshold%s",
                        hpPct, critical ? " (critical)" : ""));
            }
        }
        return Optional.empty();
    }
}
