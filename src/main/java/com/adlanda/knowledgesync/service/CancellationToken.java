package com.adlanda.knowledgesync.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared shutdown signal observed by the sync loop and the insights worker.
 *
 * Sleeping through the token returns early as soon as it is cancelled.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for the given duration or until cancelled.
     *
     * @return true if the full duration elapsed, false if the token was cancelled (or the thread interrupted)
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }
}
