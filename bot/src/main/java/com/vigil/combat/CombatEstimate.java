package com.vigil.combat;

import lombok.Value;

/**
 * Local planning estimate for the current fight. Advisory only: the contract rolls
 * armor slots and critical hits independently, and settlement is authoritative.
 */
@Value
public class CombatEstimate {

    /**
     * Damage one of our hits deals to the beast, after its armor, floored at the contract minimum.
     */
    int hitDamage;

    /**
     * Beast damage per hit averaged over the five armor slots.
     */
    double incomingPerHit;

    /**
     * Beast damage per hit on the weakest armor slot.
     */
    int maxIncomingPerHit;

    int turnsToKill;

    /**
     * {@code incomingPerHit * (turnsToKill - 1)}: the beast answers every hit but the killing one.
     */
    double expectedFightDamage;

    /**
     * Damage expected while retrying a flee with the given success chance:
     * {@code incomingPerHit * (1 / fleeChance - 1)}.
     */
    public double expectedFleeDamage(double fleeChance) {
        if (fleeChance <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return incomingPerHit * (1.0 / Math.min(1.0, fleeChance) - 1.0);
    }

    public boolean isOneHitKillRisk(int hp) {
        return maxIncomingPerHit >= hp;
    }
}
