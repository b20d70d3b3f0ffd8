package com.adlanda.knowledgesync.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code checkForChanges} call.
 *
 * @param changes        Diff against the checkpoint
 * @param candidateItems Known items for the next checkpoint if every change succeeds;
 *                       excludes items hidden by listing errors
 * @param listingErrors  Non-fatal errors, one per unreachable subtree or file
 * @param initialScan    True when the checkpoint was empty and everything is reported as added
 */
public record WatchResult(
        ChangeSet changes,
        Map<String, ItemFingerprint> candidateItems,
        List<String> listingErrors,
        boolean initialScan
) {

    public WatchResult {
        candidateItems = Map.copyOf(candidateItems);
        listingErrors = List.copyOf(listingErrors);
    }
}
