package com.vigil.observe;

/**
 * Milestone names emitted by the run loop.
 */
public final class Milestones {

    public static final String XP_GAIN = "xp_gain";
    public static final String ACTION_COUNT = "action_count";
    public static final String LEVEL_UP = "level_up";
    public static final String NEW_MAX_LEVEL = "new_max_level";
    public static final String TARGET_LEVEL_REACHED = "target_level_reached";
    public static final String DEATH = "death";
    public static final String IDENTITY_ROTATED = "identity_rotated";

    private Milestones() {
    }
}
