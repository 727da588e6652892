package com.vigil.timing;

/**
 * Sleeps in bounded chunks and checks the stop signal between them, so
 * cancellation latency never exceeds one chunk.
 */
public class ChunkedSleeper implements Sleeper {

    private final StopSignal stopSignal;
    private final long chunkMs;

    public ChunkedSleeper(StopSignal stopSignal, long chunkMs) {
        this.stopSignal = stopSignal;
        this.chunkMs = Math.max(1, chunkMs);
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        long remaining = millis;
        while (remaining > 0 && !stopSignal.isStopRequested()) {
            long chunk = Math.min(chunkMs, remaining);
            Thread.sleep(chunk);
            remaining -= chunk;
        }
    }
}
