package com.vigil.state;

import lombok.Value;

/**
 * The beast the adventurer is currently facing. A beast with zero health means
 * the adventurer is not in combat.
 */
@Value
public class Beast {

    public static final Beast NONE = new Beast(0, 0, 0, false);

    int id;
    int health;
    int level;
    boolean collectable;

    public boolean isAlive() {
        return health > 0;
    }
}
