package com.vigil;

import com.vigil.runner.WriteExecutor;
import com.vigil.testutil.ManualClock;
import com.vigil.timing.StopSignal;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class VigilLauncherTest {

    private WriteExecutor writeExecutor;
    private CountDownLatch release;

    @Before
    public void setUp() {
        writeExecutor = new WriteExecutor(new ManualClock());
        release = new CountDownLatch(1);
    }

    @After
    public void tearDown() {
        release.countDown();
        writeExecutor.close();
    }

    // ========================================================================
    // Shutdown
    // ========================================================================

    @Test
    public void testShutdownHook_StopsLoopBlockedOnWrite() throws Exception {
        StopSignal stopSignal = new StopSignal();
        CountDownLatch writeStarted = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        Thread loopThread = new Thread(() -> {
            try {
                writeExecutor.submit(() -> {
                    writeStarted.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                }, 60_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        }, "loop-under-test");
        loopThread.start();
        assertTrue(writeStarted.await(5, TimeUnit.SECONDS));

        long started = System.nanoTime();
        VigilLauncher.shutdownHook(stopSignal, loopThread, 5_000).run();

        assertTrue(stopSignal.isStopRequested());
        assertFalse(loopThread.isAlive());
        assertTrue(interrupted.get());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
    }

    @Test
    public void testShutdownHook_ReturnsWhenLoopAlreadyFinished() throws Exception {
        StopSignal stopSignal = new StopSignal();
        Thread loopThread = new Thread(() -> { });
        loopThread.start();
        loopThread.join();

        VigilLauncher.shutdownHook(stopSignal, loopThread, 1_000).run();

        assertTrue(stopSignal.isStopRequested());
    }
}
