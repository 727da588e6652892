package com.vigil.data;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The eight fixed equipment slots of an adventurer.
 */
public enum ItemSlot {
    WEAPON,
    CHEST,
    HEAD,
    WAIST,
    FOOT,
    HAND,
    NECK,
    RING,
    /**
     * Unknown or empty slot reported by the catalog.
     */
    NONE;

    /**
     * The five slots a beast can strike.
     */
    public static final Set<ItemSlot> ARMOR = EnumSet.of(CHEST, HEAD, WAIST, FOOT, HAND);

    public static final Set<ItemSlot> JEWELRY = EnumSet.of(NECK, RING);

    public boolean isArmor() {
        return ARMOR.contains(this);
    }

    public boolean isJewelry() {
        return JEWELRY.contains(this);
    }

    /**
     * Parse a slot name as the chain reports it ("Weapon", "chest", "Foot"...).
     * Unrecognized names map to {@link #NONE}.
     */
    public static ItemSlot fromName(String name) {
        if (name == null) {
            return NONE;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ItemSlot slot : values()) {
            if (slot.name().equals(normalized)) {
                return slot;
            }
        }
        return NONE;
    }
}
