package com.adlanda.knowledgesync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable record of what the watcher has already accounted for.
 *
 * Immutable: a cycle receives one checkpoint and produces the next one.
 *
 * @param lastCheckTime Start time of the last completed cycle, null before the first one
 * @param knownItems    Fingerprints by item id as of the last completed cycle
 */
public record SyncCheckpoint(
        Instant lastCheckTime,
        Map<String, ItemFingerprint> knownItems
) {

    public SyncCheckpoint {
        knownItems = knownItems == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(knownItems));
    }

    /**
     * Checkpoint used when nothing has been stored yet.
     */
    public static SyncCheckpoint empty() {
        return new SyncCheckpoint(null, Map.of());
    }

    /**
     * True when no cycle has ever completed against this source.
     */
    public boolean isEmpty() {
        return lastCheckTime == null && knownItems.isEmpty();
    }

    public SyncCheckpoint advance(Instant checkTime, Map<String, ItemFingerprint> items) {
        return new SyncCheckpoint(checkTime, items);
    }
}
