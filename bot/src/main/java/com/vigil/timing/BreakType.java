package com.vigil.timing;

import lombok.Getter;

/**
 * Scheduled pauses that make activity look human. Intervals and durations come
 * from {@link com.vigil.config.PacingConfig}.
 */
@Getter
public enum BreakType {

    /**
     * A few minutes away: checking the phone, a drink.
     */
    SHORT_BREAK("Short break"),

    /**
     * Extended absence such as a meal or sleeping.
     */
    LONG_BREAK("Long break");

    private final String displayName;

    BreakType(String displayName) {
        this.displayName = displayName;
    }
}
