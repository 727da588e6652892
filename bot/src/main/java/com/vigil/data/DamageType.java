package com.vigil.data;

import java.util.Locale;

/**
 * Item type as minted in the loot contract. Weapons carry an attack type,
 * armor carries an armor type, jewelry has its own types.
 */
public enum DamageType {
    MAGIC,
    BLADE,
    BLUDGEON,
    CLOTH,
    HIDE,
    METAL,
    NECKLACE,
    RING,
    NONE;

    public boolean isAttackType() {
        return this == MAGIC || this == BLADE || this == BLUDGEON;
    }

    public boolean isArmorType() {
        return this == CLOTH || this == HIDE || this == METAL;
    }

    /**
     * Parse a type name ("Magic", "bludgeon", "Necklace"...). Unknown names map to {@link #NONE}.
     */
    public static DamageType fromName(String name) {
        if (name == null) {
            return NONE;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (DamageType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return NONE;
    }
}
