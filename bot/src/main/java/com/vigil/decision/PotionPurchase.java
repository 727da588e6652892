package com.vigil.decision;

import lombok.Value;

@Value
public class PotionPurchase implements ActionPayload {
    int count;
    int unitPrice;

    public int totalPrice() {
        return count * unitPrice;
    }
}
