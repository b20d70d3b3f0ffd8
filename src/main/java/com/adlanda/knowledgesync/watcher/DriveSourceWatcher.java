package com.adlanda.knowledgesync.watcher;

import com.adlanda.knowledgesync.exception.SourceUnavailableException;
import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.RawContent;
import com.adlanda.knowledgesync.model.SourceItem;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.model.WatchResult;
import com.adlanda.knowledgesync.watcher.SourceListing.ListingError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Watches a remote drive folder tree, including subfolders.
 *
 * Items are identified by file id and fingerprinted by revision. A subfolder that cannot
 * be listed becomes a listing error; the root folder failing to list aborts the check.
 */
public class DriveSourceWatcher implements SourceWatcher {

    private static final Logger log = LoggerFactory.getLogger(DriveSourceWatcher.class);

    private final DriveClient driveClient;
    private final String rootFolderId;
    private final ChangeDetector changeDetector;

    public DriveSourceWatcher(DriveClient driveClient, String rootFolderId, ChangeDetector changeDetector) {
        this.driveClient = driveClient;
        this.rootFolderId = rootFolderId;
        this.changeDetector = changeDetector;
    }

    @Override
    public WatchResult checkForChanges(SyncCheckpoint checkpoint) {
        SourceListing listing = list();
        log.debug("Listed {} remote files under {} ({} listing errors)",
                listing.items().size(), rootFolderId, listing.errors().size());
        return changeDetector.detect(checkpoint, listing);
    }

    SourceListing list() {
        List<SourceItem> items = new ArrayList<>();
        List<ListingError> errors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Folder> pending = new ArrayDeque<>();
        pending.add(new Folder(rootFolderId, ""));

        while (!pending.isEmpty()) {
            Folder folder = pending.poll();
            if (!visited.add(folder.id())) {
                continue;
            }

            List<DriveFile> children;
            try {
                children = driveClient.listChildren(folder.id());
            } catch (IOException e) {
                if (folder.path().isEmpty()) {
                    throw new SourceUnavailableException("Cannot list remote root folder " + rootFolderId, e);
                }
                log.warn("Skipping unreachable folder {}: {}", folder.path(), e.getMessage());
                errors.add(new ListingError(folder.path(), String.valueOf(e.getMessage())));
                continue;
            }

            for (DriveFile file : children) {
                String path = folder.path().isEmpty() ? file.name() : folder.path() + "/" + file.name();
                if (file.isFolder()) {
                    pending.add(new Folder(file.id(), path));
                } else if (file.isGoogleNative() && !file.isExportable()) {
                    log.debug("Skipping non-exportable native file {} ({})", path, file.mimeType());
                } else {
                    items.add(toItem(file, path));
                }
            }
        }

        return new SourceListing(items, errors);
    }

    @Override
    public RawContent fetch(SourceItem item) throws IOException {
        byte[] bytes = driveClient.download(item.id(), item.mimeType());
        return new RawContent(bytes, DriveFile.contentTypeFor(item.mimeType()));
    }

    @Override
    public String describe() {
        return "remote:" + rootFolderId;
    }

    private SourceItem toItem(DriveFile file, String path) {
        ItemFingerprint fingerprint = new ItemFingerprint(
                file.id(),
                path,
                file.revision(),
                file.size() != null ? file.size() : -1L);
        return new SourceItem(file.id(), file.name(), path, file.mimeType(), fingerprint);
    }

    private record Folder(String id, String path) {}
}
