package com.vigil.decision;

import com.vigil.data.ItemSlot;
import lombok.Value;

/**
 * A single market item, optionally equipped in the same transaction.
 */
@Value
public class ItemPurchase {
    int itemId;
    boolean equip;
    ItemSlot slot;
    int price;
}
