package com.vigil.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the runner configuration tree. Defaults live in field initializers, so a
 * partial JSON file only overrides what it names.
 */
@Data
public class RunnerConfig {

    private AppConfig app = new AppConfig();
    private PolicyConfig policy = new PolicyConfig();
    private ChainConfig chain = new ChainConfig();
    private SessionConfig session = new SessionConfig();
    private RecoveryConfig recovery = new RecoveryConfig();
    private PacingConfig pacing = new PacingConfig();
    private LoggingConfig logging = new LoggingConfig();

    /**
     * @throws ConfigException listing every invalid field
     */
    public void validate() {
        List<String> issues = new ArrayList<>();
        if (app == null || policy == null || chain == null || session == null
                || recovery == null || pacing == null || logging == null) {
            throw new ConfigException("Config sections must not be null");
        }

        // policy
        positive(issues, "policy.hpBase", policy.getHpBase());
        positive(issues, "policy.hpPerVitality", policy.getHpPerVitality());
        positive(issues, "policy.targetLevel", policy.getTargetLevel());
        nonNegative(issues, "policy.startingWeaponId", policy.getStartingWeaponId());
        fraction(issues, "policy.fleeBelowHpPct", policy.getFleeBelowHpPct());
        fraction(issues, "policy.minFleeChance", policy.getMinFleeChance());
        fraction(issues, "policy.criticalHpRatio", policy.getCriticalHpRatio());
        range(issues, "policy.maxBeastLevelRatio", policy.getMaxBeastLevelRatio(), 0.5, 5.0);
        fraction(issues, "policy.nearFullHpPct", policy.getNearFullHpPct());
        positive(issues, "policy.slowFightTurns", policy.getSlowFightTurns());
        fraction(issues, "policy.slowFightMinFleeChance", policy.getSlowFightMinFleeChance());
        range(issues, "policy.fightDamageHpRatio", policy.getFightDamageHpRatio(), 0.0, 5.0);
        fraction(issues, "policy.fightDamageMinFleeChance", policy.getFightDamageMinFleeChance());
        fraction(issues, "policy.midCombatEquipMinReduction", policy.getMidCombatEquipMinReduction());
        fraction(issues, "policy.buyPotionIfBelowPct", policy.getBuyPotionIfBelowPct());
        fraction(issues, "policy.cheapPotionHealTargetPct", policy.getCheapPotionHealTargetPct());
        nonNegative(issues, "policy.goldReserve", policy.getGoldReserve());
        range(issues, "policy.marketUpgradeMargin", policy.getMarketUpgradeMargin(), 0.0, 5.0);
        fraction(issues, "policy.equipUpgradeThreshold", policy.getEquipUpgradeThreshold());
        fraction(issues, "policy.armorDowngradeTolerance", policy.getArmorDowngradeTolerance());
        positive(issues, "policy.potentialHorizonLevel", policy.getPotentialHorizonLevel());
        fraction(issues, "policy.potentialBiasWeight", policy.getPotentialBiasWeight());
        nonNegative(issues, "policy.potionCharismaCap", policy.getPotionCharismaCap());
        range(issues, "policy.dexTargetRatio", policy.getDexTargetRatio(), 0.0, 2.0);
        range(issues, "policy.vitTargetRatio", policy.getVitTargetRatio(), 0.0, 2.0);
        range(issues, "policy.chaTargetRatio", policy.getChaTargetRatio(), 0.0, 2.0);
        range(issues, "policy.strTargetRatio", policy.getStrTargetRatio(), 0.0, 2.0);
        range(issues, "policy.intTargetRatio", policy.getIntTargetRatio(), 0.0, 2.0);
        range(issues, "policy.wisTargetRatio", policy.getWisTargetRatio(), 0.0, 2.0);
        if (policy.getStatUpgradePriority() == null || policy.getStatUpgradePriority().isEmpty()
                || policy.getStatUpgradePriority().contains(null)) {
            issues.add("policy.statUpgradePriority: must list at least one known stat");
        }
        fraction(issues, "policy.exploreTillBeastPct", policy.getExploreTillBeastPct());

        // chain
        if (!ChainConfig.SIGNER_CONTROLLER.equals(chain.getSigner())
                && !ChainConfig.SIGNER_SESSION_KEY.equals(chain.getSigner())) {
            issues.add("chain.signer: must be '" + ChainConfig.SIGNER_CONTROLLER + "' or '"
                    + ChainConfig.SIGNER_SESSION_KEY + "'");
        }
        notBlank(issues, "chain.bridgeUrl", chain.getBridgeUrl());
        notBlank(issues, "chain.rpcUrl", chain.getRpcUrl());
        notBlank(issues, "chain.gameContract", chain.getGameContract());
        positive(issues, "chain.requestTimeoutMs", chain.getRequestTimeoutMs());
        positive(issues, "chain.readAttempts", chain.getReadAttempts());
        nonNegative(issues, "chain.readRetryBaseDelayMs", chain.getReadRetryBaseDelayMs());
        positive(issues, "chain.controllerReconnectAttempts", chain.getControllerReconnectAttempts());

        // session
        notBlank(issues, "session.file", session.getFile());
        nonNegative(issues, "session.adventurerId", session.getAdventurerId());

        // recovery
        positive(issues, "recovery.writeTimeoutMs", recovery.getWriteTimeoutMs());
        positive(issues, "recovery.settlementTimeoutMs", recovery.getSettlementTimeoutMs());
        positive(issues, "recovery.settlementPollIntervalMs", recovery.getSettlementPollIntervalMs());
        positive(issues, "recovery.awaitSettlementTimeoutMs", recovery.getAwaitSettlementTimeoutMs());
        positive(issues, "recovery.staleProgressMs", recovery.getStaleProgressMs());
        positive(issues, "recovery.maxConsecutiveFailures", recovery.getMaxConsecutiveFailures());
        nonNegative(issues, "recovery.failureBackoffMs", recovery.getFailureBackoffMs());
        positive(issues, "recovery.idlePollMs", recovery.getIdlePollMs());
        nonNegative(issues, "recovery.deathCooldownMs", recovery.getDeathCooldownMs());
        positive(issues, "recovery.randomnessBaseDelayMs", recovery.getRandomnessBaseDelayMs());
        if (recovery.getRandomnessMaxDelayMs() < recovery.getRandomnessBaseDelayMs()) {
            issues.add("recovery.randomnessMaxDelayMs: must be >= randomnessBaseDelayMs");
        }
        positive(issues, "recovery.randomnessCircuitAttempts", recovery.getRandomnessCircuitAttempts());
        positive(issues, "recovery.randomnessCircuitWindowMs", recovery.getRandomnessCircuitWindowMs());
        positive(issues, "recovery.randomnessCircuitOpenMs", recovery.getRandomnessCircuitOpenMs());
        positive(issues, "recovery.randomnessResyncIntervalMs", recovery.getRandomnessResyncIntervalMs());
        nonNegative(issues, "recovery.marketClosedCooldownMs", recovery.getMarketClosedCooldownMs());
        nonNegative(issues, "recovery.statsBlockedCooldownMs", recovery.getStatsBlockedCooldownMs());
        nonNegative(issues, "recovery.gearRejectedCooldownMs", recovery.getGearRejectedCooldownMs());

        // pacing
        validRange(issues, "pacing.thinkDelay", pacing.getThinkDelay());
        validRange(issues, "pacing.nearDeathDwell", pacing.getNearDeathDwell());
        validRange(issues, "pacing.marketDwell", pacing.getMarketDwell());
        validRange(issues, "pacing.levelUpDwell", pacing.getLevelUpDwell());
        fraction(issues, "pacing.nearDeathHpPct", pacing.getNearDeathHpPct());
        validRange(issues, "pacing.shortBreakEvery", pacing.getShortBreakEvery());
        validRange(issues, "pacing.shortBreakDuration", pacing.getShortBreakDuration());
        validRange(issues, "pacing.longBreakEvery", pacing.getLongBreakEvery());
        validRange(issues, "pacing.longBreakDuration", pacing.getLongBreakDuration());
        nonNegative(issues, "pacing.identityJitterMaxMs", pacing.getIdentityJitterMaxMs());
        nonNegative(issues, "pacing.maxWritesPerMinute", pacing.getMaxWritesPerMinute());
        positive(issues, "pacing.sleepChunkMs", pacing.getSleepChunkMs());

        // logging
        notBlank(issues, "app.dataDir", app.getDataDir());
        notBlank(issues, "logging.eventsFile", logging.getEventsFile());
        notBlank(issues, "logging.milestonesFile", logging.getMilestonesFile());

        if (!issues.isEmpty()) {
            throw new ConfigException(issues);
        }
    }

    // ========================================================================
    // Validation helpers
    // ========================================================================

    private static void positive(List<String> issues, String field, long value) {
        if (value <= 0) {
            issues.add(field + ": must be positive, got " + value);
        }
    }

    private static void nonNegative(List<String> issues, String field, long value) {
        if (value < 0) {
            issues.add(field + ": must not be negative, got " + value);
        }
    }

    private static void fraction(List<String> issues, String field, double value) {
        range(issues, field, value, 0.0, 1.0);
    }

    private static void range(List<String> issues, String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            issues.add(field + ": must be within [" + min + ", " + max + "], got " + value);
        }
    }

    private static void notBlank(List<String> issues, String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            issues.add(field + ": must not be blank");
        }
    }

    private static void validRange(List<String> issues, String field, RangeMs value) {
        if (value == null || !value.isValid()) {
            issues.add(field + ": must have 0 <= min <= max");
        }
    }
}
