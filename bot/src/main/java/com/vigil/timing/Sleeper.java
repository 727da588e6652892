package com.vigil.timing;

/**
 * Blocking wait used for every delay in the run loop, so tests can substitute a
 * clock-advancing implementation.
 */
public interface Sleeper {

    /**
     * Sleep up to {@code millis}. Returns early when a stop is requested.
     */
    void sleep(long millis) throws InterruptedException;
}
