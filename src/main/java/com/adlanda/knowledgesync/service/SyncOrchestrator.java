package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.exception.DocumentProcessingException;
import com.adlanda.knowledgesync.exception.SourceUnavailableException;
import com.adlanda.knowledgesync.exception.StateStoreException;
import com.adlanda.knowledgesync.exception.SyncCycleException;
import com.adlanda.knowledgesync.exception.UnsupportedContentException;
import com.adlanda.knowledgesync.health.SyncHealthIndicator;
import com.adlanda.knowledgesync.model.ChangeSet;
import com.adlanda.knowledgesync.model.CycleStats;
import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.model.WatchResult;
import com.adlanda.knowledgesync.service.StateStore.SaveOutcome;
import com.adlanda.knowledgesync.watcher.SourceWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs sync cycles: diff the source against the checkpoint, apply the changes, advance the checkpoint.
 *
 * Items are processed sequentially. A failing item is logged and left out of the next
 * checkpoint so it is picked up again; it never stops the rest of the cycle.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final StateStore stateStore;
    private final SourceWatcher sourceWatcher;
    private final DocumentProcessor documentProcessor;
    private final SyncHealthIndicator healthIndicator;
    private final Clock clock;

    public SyncOrchestrator(StateStore stateStore,
                            SourceWatcher sourceWatcher,
                            DocumentProcessor documentProcessor,
                            SyncHealthIndicator healthIndicator,
                            Clock clock) {
        this.stateStore = stateStore;
        this.sourceWatcher = sourceWatcher;
        this.documentProcessor = documentProcessor;
        this.healthIndicator = healthIndicator;
        this.clock = clock;
    }

    /**
     * Runs one check cycle end-to-end.
     *
     * @return statistics of the cycle, also when some items failed
     * @throws SyncCycleException if the source could not be listed or the checkpoint could not be loaded or saved
     */
    public CycleStats runOnce() {
        Instant cycleStart = clock.instant();
        long startNanos = System.nanoTime();

        SyncCheckpoint checkpoint;
        WatchResult result;
        try {
            checkpoint = stateStore.load();
            result = sourceWatcher.checkForChanges(checkpoint);
        } catch (SourceUnavailableException | StateStoreException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw new SyncCycleException("Sync cycle aborted for " + sourceWatcher.describe() + ": " + e.getMessage(), e);
        }

        ChangeSet changes = result.changes();
        if (result.initialScan()) {
            log.info("Initial scan of {}: {} items found", sourceWatcher.describe(), changes.added().size());
        } else if (!changes.isEmpty()) {
            log.info("Changes in {}: {} added, {} modified, {} removed", sourceWatcher.describe(),
                    changes.added().size(), changes.modified().size(), changes.removed().size());
        }
        result.listingErrors().forEach(error -> log.warn("Partial listing, will re-evaluate next cycle: {}", error));

        Map<String, ItemFingerprint> nextKnown = new LinkedHashMap<>(result.candidateItems());
        int processed = 0;
        int deleted = 0;
        int errors = 0;
        int chunks = 0;

        for (SourceItem item : changes.added()) {
            int written = processItem(item);
            if (written >= 0) {
                processed++;
                chunks += written;
            } else {
                errors++;
                nextKnown.remove(item.id());
            }
        }

        for (SourceItem item : changes.modified()) {
            int written = processItem(item);
            if (written >= 0) {
                processed++;
                chunks += written;
            } else {
                errors++;
                // Keep the old fingerprint: the item stays "modified" next cycle and stays removable
                nextKnown.put(item.id(), checkpoint.knownItems().get(item.id()));
            }
        }

        for (String itemId : changes.removed()) {
            try {
                documentProcessor.remove(itemId);
                deleted++;
            } catch (DocumentProcessingException e) {
                errors++;
                nextKnown.put(itemId, checkpoint.knownItems().get(itemId));
                log.error("Failed to remove {}: {}", itemId, e.getMessage(), e);
            }
        }

        SaveOutcome outcome;
        try {
            outcome = stateStore.save(checkpoint.advance(cycleStart, nextKnown));
        } catch (StateStoreException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw new SyncCycleException("Sync cycle could not persist its checkpoint: " + e.getMessage(), e);
        }

        int unchanged = result.candidateItems().size() - changes.added().size() - changes.modified().size();
        CycleStats stats = new CycleStats(
                processed,
                deleted,
                errors,
                unchanged,
                chunks,
                result.listingErrors().size(),
                result.initialScan(),
                outcome == SaveOutcome.DEGRADED,
                Duration.ofNanos(System.nanoTime() - startNanos));

        log.info("Sync cycle complete for {}: {} processed, {} deleted, {} errors, {} unchanged, {} chunks, {} listing errors in {} ms{}",
                sourceWatcher.describe(), stats.processed(), stats.deleted(), stats.errors(), stats.unchanged(),
                stats.chunks(), stats.listingErrors(), stats.duration().toMillis(),
                stats.degradedState() ? " (checkpoint in fallback file)" : "");

        healthIndicator.recordCycle(stats);
        return stats;
    }

    /**
     * Runs cycles every {@code interval} until the token is cancelled.
     *
     * A cycle in progress when cancellation arrives runs to completion; no cycle starts afterwards.
     */
    public void runForever(Duration interval, CancellationToken cancellation) {
        log.info("Continuous sync of {} every {} s", sourceWatcher.describe(), interval.toSeconds());

        while (!cancellation.isCancelled()) {
            try {
                runOnce();
            } catch (SyncCycleException e) {
                log.error("Sync cycle failed, retrying in {} s: {}", interval.toSeconds(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error in sync cycle, retrying in {} s", interval.toSeconds(), e);
            }

            if (!cancellation.sleep(interval)) {
                break;
            }
        }

        log.info("Continuous sync of {} stopped", sourceWatcher.describe());
    }

    /**
     * @return chunks written, or -1 if the item failed
     */
    private int processItem(SourceItem item) {
        try {
            return documentProcessor.process(item);
        } catch (UnsupportedContentException e) {
            log.warn("Skipping {}: {}", item.path(), e.getMessage());
        } catch (DocumentProcessingException e) {
            log.error("Failed to process {}: {}", item.path(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}", item.path(), e);
        }
        return -1;
    }
}
