package com.vigil.state;

import lombok.Value;

/**
 * An owned loot item: its catalog id and the experience it has accumulated.
 */
@Value
public class Item {
    int id;
    int xp;
}
