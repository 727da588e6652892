package com.vigil.decision;

import lombok.Builder;
import lombok.Value;

/**
 * Per-iteration switches the run loop sets from its blockers.
 */
@Value
@Builder(toBuilder = true)
public class DecisionOptions {

    public static final DecisionOptions DEFAULT = DecisionOptions.builder().build();

    @Builder.Default
    boolean considerEquip = true;

    /**
     * False while the market is known to be closed for the current action count.
     */
    @Builder.Default
    boolean allowMarket = true;

    /**
     * False while stat selection is blocked for the current action count.
     */
    @Builder.Default
    boolean allowStatSelection = true;

    /**
     * False while item purchases are held back; potions may still be bought.
     */
    @Builder.Default
    boolean allowGearPurchase = true;
}
