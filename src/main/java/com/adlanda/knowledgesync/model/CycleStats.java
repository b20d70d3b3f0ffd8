package com.adlanda.knowledgesync.model;

import java.time.Duration;

/**
 * Aggregated statistics of one sync cycle.
 *
 * @param processed     Added or modified items processed successfully
 * @param deleted       Removed items whose chunks were deleted
 * @param errors        Items whose processing or removal failed
 * @param unchanged     Listed items that needed no work
 * @param chunks        Chunks written during the cycle
 * @param listingErrors Non-fatal listing errors reported by the watcher
 * @param initialScan   Whether this was a full scan against an empty checkpoint
 * @param degradedState Whether the checkpoint was written to the fallback file
 * @param duration      Wall-clock duration of the cycle
 */
public record CycleStats(
        int processed,
        int deleted,
        int errors,
        int unchanged,
        int chunks,
        int listingErrors,
        boolean initialScan,
        boolean degradedState,
        Duration duration
) {

    public int attempted() {
        return processed + deleted + errors;
    }

    public int succeeded() {
        return processed + deleted;
    }

    /**
     * A cycle fails as a whole only when it tried something and nothing worked.
     */
    public boolean isTotalFailure() {
        return attempted() > 0 && succeeded() == 0;
    }
}
