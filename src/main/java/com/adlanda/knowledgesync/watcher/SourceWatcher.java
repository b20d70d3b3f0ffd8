package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.model.RawContent;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.model.WatchResult;

import java.io.IOException;

/**
 * Lists a document source and diffs it against a checkpoint.
 *
 * Implementations are selected by {@code sync.source} in {@link com.adlanda.knowledgesync.config.SourceWatcherConfig}.
 */
public interface SourceWatcher {

    /**
     * Lists the source and classifies every item against the checkpoint.
     *
     * @throws com.adlanda.knowledgesync.exception.SourceUnavailableException if the source cannot be listed at all
     */
    WatchResult checkForChanges(SyncCheckpoint checkpoint);

    /**
     * Reads the current bytes of a listed item.
     */
    RawContent fetch(SourceItem item) throws IOException;

    /**
     * Short description for logs, e.g. {@code local:/data/docs}.
     */
    String describe();
}
