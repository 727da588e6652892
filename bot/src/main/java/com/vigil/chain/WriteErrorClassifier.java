package com.vigil.chain;

import java.util.Locale;

/**
 * Maps free-form signer and contract error text to a {@link WriteErrorKind}.
 * Used only inside writer implementations.
 */
public final class WriteErrorClassifier {

    private static final String[] RANDOMNESS = {
            "not fulfilled", "vrf", "randomness", "request_random", "consume_random"
    };
    private static final String[] MARKET_CLOSED = {"market is closed", "market closed"};
    private static final String[] NOT_IN_BATTLE = {"not in battle", "not in combat", "no beast"};
    private static final String[] STATS_BLOCKED = {
            "stat upgrade", "stat_upgrade", "insufficient stat", "no stat points"
    };
    private static final String[] DEAD = {"adventurer is dead", "dead adventurer"};
    private static final String[] SIGNER = {"not_connected", "no_controller", "page_closed", "session expired"};

    private WriteErrorClassifier() {
    }

    public static WriteErrorKind classify(String message) {
        if (message == null || message.isEmpty()) {
            return WriteErrorKind.UNCLASSIFIED;
        }
        String text = message.toLowerCase(Locale.ROOT);
        // Market and battle checks go first: their messages can mention randomness in a stack trace.
        if (containsAny(text, MARKET_CLOSED)) {
            return WriteErrorKind.MARKET_CLOSED;
        }
        if (containsAny(text, NOT_IN_BATTLE)) {
            return WriteErrorKind.NOT_IN_BATTLE;
        }
        if (containsAny(text, DEAD)) {
            return WriteErrorKind.DEAD_ADVENTURER;
        }
        if (containsAny(text, STATS_BLOCKED)) {
            return WriteErrorKind.STATS_BLOCKED;
        }
        if (containsAny(text, RANDOMNESS)) {
            return WriteErrorKind.RANDOMNESS_PENDING;
        }
        if (containsAny(text, SIGNER)) {
            return WriteErrorKind.SIGNER_UNAVAILABLE;
        }
        return WriteErrorKind.UNCLASSIFIED;
    }

    static boolean containsAny(String text, String[] needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
