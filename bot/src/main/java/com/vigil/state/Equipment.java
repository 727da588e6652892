package com.vigil.state;

import com.vigil.data.ItemSlot;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the eight equipment slots.
 *
 * <p>Loadout simulation works on copies produced by {@link #with(ItemSlot, Item)};
 * the snapshot taken from the chain is never modified.
 */
@Value
public class Equipment {

    public static final Equipment EMPTY = new Equipment(Collections.emptyMap());

    /**
     * Equipped items by slot. Empty slots are absent.
     */
    Map<ItemSlot, Item> slots;

    public Equipment(Map<ItemSlot, Item> slots) {
        EnumMap<ItemSlot, Item> copy = new EnumMap<>(ItemSlot.class);
        if (slots != null) {
            for (Map.Entry<ItemSlot, Item> entry : slots.entrySet()) {
                if (entry.getKey() != ItemSlot.NONE && entry.getValue() != null && entry.getValue().getId() > 0) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.slots = Collections.unmodifiableMap(copy);
    }

    @Nullable
    public Item get(ItemSlot slot) {
        return slots.get(slot);
    }

    public Optional<Item> find(ItemSlot slot) {
        return Optional.ofNullable(slots.get(slot));
    }

    public boolean isEmpty(ItemSlot slot) {
        return !slots.containsKey(slot);
    }

    /**
     * @return a copy with {@code item} in {@code slot} (or the slot cleared when item is null)
     */
    public Equipment with(ItemSlot slot, @Nullable Item item) {
        EnumMap<ItemSlot, Item> copy = new EnumMap<>(ItemSlot.class);
        copy.putAll(slots);
        if (item == null) {
            copy.remove(slot);
        } else {
            copy.put(slot, item);
        }
        return new Equipment(copy);
    }

    /**
     * @return armor slots with nothing equipped, in slot order
     */
    public List<ItemSlot> emptyArmorSlots() {
        List<ItemSlot> empty = new ArrayList<>();
        for (ItemSlot slot : ItemSlot.values()) {
            if (slot.isArmor() && isEmpty(slot)) {
                empty.add(slot);
            }
        }
        return empty;
    }

    public boolean isEquipped(int itemId) {
        for (Item item : slots.values()) {
            if (item.getId() == itemId) {
                return true;
            }
        }
        return false;
    }
}
