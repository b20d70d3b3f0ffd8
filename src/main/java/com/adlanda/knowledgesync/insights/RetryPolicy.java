package com.adlanda.knowledgesync.insights;

import java.time.Duration;

/**
 * Exponential backoff between attempts of one queue task.
 *
 * delay(n) = min(base * 2^(n-1), max), where n is the number of failed attempts so far.
 */
public record RetryPolicy(int maxAttempts, Duration base, Duration max) {

    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public boolean isExhausted(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }
}
