package com.vigil;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.vigil.config.ConfigException;
import com.vigil.config.ConfigLoader;
import com.vigil.config.RunnerConfig;
import com.vigil.runner.RunLoop;
import com.vigil.runner.RunnerModule;
import com.vigil.runner.WriteExecutor;
import com.vigil.timing.StopSignal;
import lombok.extern.slf4j.Slf4j;

/**
 * Process entry point: load the configuration, wire the runner and loop until stopped.
 *
 * <p>Usage: {@code vigil [config.json]}. Only configuration and startup failures
 * exit with a non-zero status.
 */
@Slf4j
public class VigilLauncher {

    public static void main(String[] args) {
        RunnerConfig config;
        try {
            config = new ConfigLoader().load(args.length > 0 ? args[0] : null);
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        Injector injector = Guice.createInjector(new RunnerModule(config));
        StopSignal stopSignal = injector.getInstance(StopSignal.class);
        RunLoop loop = injector.getInstance(RunLoop.class);
        WriteExecutor writeExecutor = injector.getInstance(WriteExecutor.class);
        Runtime.getRuntime().addShutdownHook(new Thread(
                shutdownHook(stopSignal, Thread.currentThread(), config.getPacing().getSleepChunkMs() * 2),
                "vigil-shutdown"));

        try {
            loop.start();
        } catch (Exception e) {
            log.error("Startup failed", e);
            System.exit(1);
            return;
        }

        try {
            loop.run();
        } catch (Exception e) {
            log.error("Run loop failed", e);
        } finally {
            writeExecutor.close();
        }
    }

    /**
     * Raises the stop signal, then interrupts the loop thread so a sleep or an
     * in-flight write wait ends promptly, and waits up to {@code joinMs} for it.
     */
    static Runnable shutdownHook(StopSignal stopSignal, Thread loopThread, long joinMs) {
        return () -> {
            log.info("Shutdown requested");
            stopSignal.requestStop();
            loopThread.interrupt();
            try {
                loopThread.join(joinMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }
}
