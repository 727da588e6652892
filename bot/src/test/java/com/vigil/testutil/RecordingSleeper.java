package com.vigil.testutil;

import com.vigil.timing.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Records requested sleeps and advances a {@link ManualClock} instead of blocking.
 */
public class RecordingSleeper implements Sleeper {

    private final ManualClock clock;
    private final List<Long> sleeps = new ArrayList<>();

    public RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        clock.advanceMillis(millis);
    }

    public List<Long> getSleeps() {
        return sleeps;
    }

    public long totalSlept() {
        long total = 0;
        for (long sleep : sleeps) {
            total += sleep;
        }
        return total;
    }
}
