package com.vigil.config;

import org.junit.Test;

import static org.junit.Assert.*;

public class RunnerConfigTest {

    @Test
    public void testValidate_DefaultsAreValid() {
        new RunnerConfig().validate();
    }

    @Test
    public void testValidate_InvertedRange() {
        RunnerConfig config = new RunnerConfig();
        config.getPacing().setMarketDwell(RangeMs.of(5_000, 1_000));

        try {
            config.validate();
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertEquals(1, e.getIssues().size());
            assertTrue(e.getIssues().get(0).startsWith("pacing.marketDwell"));
        }
    }

    @Test
    public void testValidate_RandomnessDelayBounds() {
        RunnerConfig config = new RunnerConfig();
        config.getRecovery().setRandomnessBaseDelayMs(10_000);
        config.getRecovery().setRandomnessMaxDelayMs(5_000);

        try {
            config.validate();
            fail("expected ConfigException");
        } catch (ConfigException e) {
            assertTrue(e.getMessage().contains("recovery.randomnessMaxDelayMs"));
        }
    }

    @Test
    public void testValidate_SessionKeySignerAccepted() {
        RunnerConfig config = new RunnerConfig();
        config.getChain().setSigner(ChainConfig.SIGNER_SESSION_KEY);
        config.validate();
    }

    @Test(expected = ConfigException.class)
    public void testValidate_NullSection() {
        RunnerConfig config = new RunnerConfig();
        config.setRecovery(null);
        config.validate();
    }

    @Test
    public void testRangeMs_Validity() {
        assertTrue(RangeMs.of(0, 0).isValid());
        assertTrue(RangeMs.of(1, 2).isValid());
        assertFalse(RangeMs.of(-1, 2).isValid());
        assertFalse(RangeMs.of(3, 2).isValid());
    }
}
