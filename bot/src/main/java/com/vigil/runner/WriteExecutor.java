package com.vigil.runner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vigil.chain.SettlementHandle;
import com.vigil.chain.WriteException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a writer call on a worker thread and waits for it at most the write timeout.
 * A call that overruns is left running; its effect is picked up by the next read.
 */
@Slf4j
public class WriteExecutor implements AutoCloseable {

    @FunctionalInterface
    public interface WriteCall {
        SettlementHandle call() throws WriteException;
    }

    private final ExecutorService executor;
    private final Clock clock;

    public WriteExecutor(Clock clock) {
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("vigil-write-%d")
                .setDaemon(true)
                .build());
    }

    public WriteOutcome submit(WriteCall call, long timeoutMs) throws InterruptedException {
        long started = clock.millis();
        Future<SettlementHandle> future = executor.submit(call::call);
        try {
            SettlementHandle handle = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return WriteOutcome.submitted(handle, clock.millis() - started);
        } catch (TimeoutException e) {
            log.warn("Write did not return within {}ms, treating as unconfirmed", timeoutMs);
            return WriteOutcome.timedOut(clock.millis() - started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            long elapsed = clock.millis() - started;
            if (cause instanceof WriteException) {
                return WriteOutcome.failed((WriteException) cause, elapsed);
            }
            String message = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
            return WriteOutcome.failed(WriteException.classified(message, cause), elapsed);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
