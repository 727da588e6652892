package com.vigil.state;

import lombok.Builder;
import lombok.Value;

/**
 * The seven adventurer attributes.
 */
@Value
@Builder(toBuilder = true)
public class Stats {

    public static final Stats ZERO = Stats.builder().build();

    int strength;
    int dexterity;
    int vitality;
    int intelligence;
    int wisdom;
    int charisma;
    int luck;

    public int get(StatType type) {
        switch (type) {
            case STRENGTH:
                return strength;
            case DEXTERITY:
                return dexterity;
            case VITALITY:
                return vitality;
            case INTELLIGENCE:
                return intelligence;
            case WISDOM:
                return wisdom;
            case CHARISMA:
                return charisma;
            case LUCK:
                return luck;
            default:
                return 0;
        }
    }
}
