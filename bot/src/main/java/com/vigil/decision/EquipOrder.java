package com.vigil.decision;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bag item ids to equip, at most one per slot.
 */
@Value
public class EquipOrder implements ActionPayload {

    List<Integer> itemIds;

    public EquipOrder(List<Integer> itemIds) {
        this.itemIds = Collections.unmodifiableList(new ArrayList<>(itemIds));
    }
}
