package com.vigil.config;

import lombok.Data;

@Data
public class SessionConfig {

    private String file = "./data/session.json";

    /**
     * Reuse the adventurer recorded in the session file.
     */
    private boolean reuse = true;

    /**
     * Fixed adventurer id; 0 means take it from the session file or the bridge.
     */
    private long adventurerId = 0;

    /**
     * Abandon a terminated adventurer and acquire a fresh one automatically.
     */
    private boolean autoRotateOnDeath = true;
}
