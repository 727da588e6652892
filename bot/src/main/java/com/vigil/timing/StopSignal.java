package com.vigil.timing;

import javax.inject.Singleton;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked at the top of every iteration and between sleep chunks.
 */
@Singleton
public class StopSignal {

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public void requestStop() {
        stopped.set(true);
    }

    public boolean isStopRequested() {
        return stopped.get();
    }
}
