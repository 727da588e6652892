package com.vigil.data;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable catalog entry for a loot item. Entries never change once minted, so
 * they are fetched once per id and cached for the lifetime of the process.
 */
@Value
@Builder
public class ItemMeta {

    int id;

    /**
     * 1 (best) to 5 (worst). 0 when the catalog did not report a tier.
     */
    int tier;

    @Builder.Default
    ItemSlot slot = ItemSlot.NONE;

    @Builder.Default
    DamageType damageType = DamageType.NONE;

    public boolean hasKnownTier() {
        return tier >= 1 && tier <= 5;
    }
}
