package com.roundpilot.core.orchestrator;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop flag that doubles as an interruptible sleep.
 * <p>
 * Loops call {@link #await(Duration)} instead of {@code Thread.sleep} so a trigger
 * wakes them immediately.
 */
public final class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for the signal.
     *
     * @return true if the signal fired or the thread was interrupted
     */
    public boolean await(Duration timeout) {
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
