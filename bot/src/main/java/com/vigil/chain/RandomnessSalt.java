package com.vigil.chain;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Inputs of the salt a randomness request is keyed on. The salt itself is the
 * Poseidon hash of these field elements, computed by the signer layer; only the
 * elements travel over the wire, as 0x-prefixed hex.
 */
@Value
public class RandomnessSalt {

    public enum Kind {
        EXPLORE,
        BATTLE
    }

    Kind kind;

    List<String> elements;

    private RandomnessSalt(Kind kind, long... values) {
        this.kind = kind;
        List<String> hex = new ArrayList<>(values.length);
        for (long value : values) {
            hex.add(toFelt(value));
        }
        this.elements = Collections.unmodifiableList(hex);
    }

    /**
     * Salt over {@code (xp, adventurerId)}.
     */
    public static RandomnessSalt explore(long xp, long adventurerId) {
        return new RandomnessSalt(Kind.EXPLORE, xp, adventurerId);
    }

    /**
     * Salt over {@code (xp, adventurerId, actionCount + 1)}: keyed on the action that is about to settle.
     */
    public static RandomnessSalt battle(long xp, long adventurerId, long actionCount) {
        return new RandomnessSalt(Kind.BATTLE, xp, adventurerId, actionCount + 1);
    }

    static String toFelt(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Field elements must not be negative: " + value);
        }
        return "0x" + Long.toHexString(value);
    }

    @Override
    public String toString() {
        return kind + Arrays.toString(elements.toArray());
    }
}
