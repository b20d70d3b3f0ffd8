package com.adlanda.knowledgesync.model;

import java.time.Duration;

/**
 * Counts of queue tasks by status.
 *
 * @param oldestPendingAge Age of the oldest pending task, null when none is pending
 */
public record QueueStats(
        long pending,
        long processing,
        long completed,
        long failed,
        Duration oldestPendingAge
) {

    public long total() {
        return pending + processing + completed + failed;
    }
}
