package com.vigil.chain;

import org.junit.Test;

import static org.junit.Assert.*;

public class WriteErrorClassifierTest {

    @Test
    public void testClassify_KnownPhrases() {
        assertEquals(WriteErrorKind.MARKET_CLOSED, WriteErrorClassifier.classify("Market is closed"));
        assertEquals(WriteErrorKind.NOT_IN_BATTLE, WriteErrorClassifier.classify("Adventurer not in battle"));
        assertEquals(WriteErrorKind.DEAD_ADVENTURER, WriteErrorClassifier.classify("Adventurer is dead"));
        assertEquals(WriteErrorKind.STATS_BLOCKED, WriteErrorClassifier.classify("Stat upgrade available"));
        assertEquals(WriteErrorKind.RANDOMNESS_PENDING, WriteErrorClassifier.classify("VRF: not fulfilled"));
        assertEquals(WriteErrorKind.SIGNER_UNAVAILABLE, WriteErrorClassifier.classify("Session expired"));
    }

    @Test
    public void testClassify_MarketBeatsRandomness() {
        assertEquals(WriteErrorKind.MARKET_CLOSED,
                WriteErrorClassifier.classify("execution reverted: market closed (consume_random)"));
    }

    @Test
    public void testClassify_BattleBeatsRandomness() {
        assertEquals(WriteErrorKind.NOT_IN_BATTLE,
                WriteErrorClassifier.classify("no beast; vrf request ignored"));
    }

    @Test
    public void testClassify_Unclassified() {
        assertEquals(WriteErrorKind.UNCLASSIFIED, WriteErrorClassifier.classify("nonce too low"));
        assertEquals(WriteErrorKind.UNCLASSIFIED, WriteErrorClassifier.classify(""));
        assertEquals(WriteErrorKind.UNCLASSIFIED, WriteErrorClassifier.classify(null));
    }

    @Test
    public void testClassifiedException_KeepsMessage() {
        WriteException e = WriteException.classified("Randomness not fulfilled yet");

        assertEquals(WriteErrorKind.RANDOMNESS_PENDING, e.getKind());
        assertEquals("Randomness not fulfilled yet", e.getMessage());
    }
}
