package com.kg.core.service.bus;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop request shared by a long-running loop and its owner.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for the given time unless cancelled first.
     * An interrupt counts as cancellation.
     *
     * @return true if cancellation was requested while waiting
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
