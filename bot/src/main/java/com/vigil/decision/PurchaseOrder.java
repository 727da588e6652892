package com.vigil.decision;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Items (and optionally potions) bought in one market transaction.
 */
@Value
public class PurchaseOrder implements ActionPayload {

    List<ItemPurchase> items;

    int potions;

    public PurchaseOrder(List<ItemPurchase> items, int potions) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.potions = potions;
    }

    public int totalPrice() {
        int total = 0;
        for (ItemPurchase item : items) {
            total += item.getPrice();
        }
        return total;
    }
}
