package com.vigil.session;

import java.io.IOException;

/**
 * Acquires the identity the run loop plays and fresh read/write handles for it.
 */
public interface SessionBootstrapper {

    /**
     * Resume the configured or recorded adventurer, or start a new one. Each call
     * builds new handles.
     */
    GameSession bootstrap() throws IOException;

    /**
     * Abandon a terminated adventurer and acquire a fresh one.
     */
    GameSession rotate(long terminatedAdventurerId) throws IOException;
}
