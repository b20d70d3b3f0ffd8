package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.model.ChangeSet;
import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.model.WatchResult;
import com.adlanda.knowledgesync.watcher.SourceListing.ListingError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diff computation shared by all watcher variants.
 *
 * Known items that sit under a location that failed to list are neither reported as
 * removed nor carried into the candidate index: the next cycle sees them as new and
 * re-evaluates them.
 */
public class ChangeDetector {

    public WatchResult detect(SyncCheckpoint checkpoint, SourceListing listing) {
        Map<String, ItemFingerprint> known = checkpoint.knownItems();
        boolean initialScan = checkpoint.isEmpty();

        List<SourceItem> added = new ArrayList<>();
        List<SourceItem> modified = new ArrayList<>();
        Map<String, ItemFingerprint> candidate = new LinkedHashMap<>();

        for (SourceItem item : listing.items()) {
            candidate.put(item.id(), item.fingerprint());
            ItemFingerprint previous = known.get(item.id());
            if (initialScan || previous == null) {
                added.add(item);
            } else if (!previous.sameContentAs(item.fingerprint())) {
                modified.add(item);
            }
        }

        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, ItemFingerprint> entry : known.entrySet()) {
            if (candidate.containsKey(entry.getKey())) {
                continue;
            }
            if (!isHidden(entry.getValue(), listing.errors())) {
                removed.add(entry.getKey());
            }
        }

        List<String> errors = listing.errors().stream()
                .map(ListingError::toString)
                .toList();

        return new WatchResult(new ChangeSet(added, modified, removed), candidate, errors, initialScan);
    }

    private boolean isHidden(ItemFingerprint fingerprint, List<ListingError> errors) {
        return errors.stream().anyMatch(error -> error.covers(fingerprint.path()));
    }
}
