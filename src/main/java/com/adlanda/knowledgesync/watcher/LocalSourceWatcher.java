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
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Watches a local directory tree.
 *
 * Items are identified by their root-relative path with '/' separators and fingerprinted
 * by modified time and size. Hidden files and directories are skipped.
 */
public class LocalSourceWatcher implements SourceWatcher {

    private static final Logger log = LoggerFactory.getLogger(LocalSourceWatcher.class);

    private static final Map<String, String> MIME_TYPES = Map.of(
            "txt", "text/plain",
            "md", "text/markdown",
            "markdown", "text/markdown",
            "csv", "text/csv",
            "json", "application/json",
            "html", "text/html",
            "htm", "text/html"
    );

    private final Path root;
    private final Set<String> extensions;
    private final ChangeDetector changeDetector;

    public LocalSourceWatcher(String watchRoot, List<String> extensions, ChangeDetector changeDetector) {
        this.root = watchRoot == null || watchRoot.isBlank() ? null : Path.of(watchRoot).toAbsolutePath().normalize();
        this.extensions = extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.changeDetector = changeDetector;
    }

    @Override
    public WatchResult checkForChanges(SyncCheckpoint checkpoint) {
        if (root == null || !Files.isDirectory(root)) {
            throw new SourceUnavailableException("Watch root is not a readable directory: " + root);
        }

        SourceListing listing = list();
        WatchResult result = changeDetector.detect(checkpoint, listing);
        log.debug("Listed {} files under {} ({} listing errors)",
                listing.items().size(), root, listing.errors().size());
        return result;
    }

    SourceListing list() {
        List<SourceItem> items = new ArrayList<>();
        List<ListingError> errors = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isHidden(file) && isSupported(file)) {
                        items.add(toItem(file, attrs));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Cannot read {}: {}", file, exc.getMessage());
                    errors.add(new ListingError(relativize(file), String.valueOf(exc.getMessage())));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        log.warn("Listing of {} incomplete: {}", dir, exc.getMessage());
                        errors.add(new ListingError(relativize(dir), String.valueOf(exc.getMessage())));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to walk watch root " + root, e);
        }

        return new SourceListing(items, errors);
    }

    @Override
    public RawContent fetch(SourceItem item) throws IOException {
        Path file = root.resolve(item.id()).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Item " + item.id() + " resolves outside the watch root");
        }
        return new RawContent(Files.readAllBytes(file), item.mimeType());
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    private SourceItem toItem(Path file, BasicFileAttributes attrs) {
        String relativePath = relativize(file);
        ItemFingerprint fingerprint = new ItemFingerprint(
                relativePath,
                relativePath,
                String.valueOf(attrs.lastModifiedTime().toMillis()),
                attrs.size());
        return new SourceItem(relativePath, file.getFileName().toString(), relativePath,
                mimeTypeOf(file), fingerprint);
    }

    private String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private boolean isSupported(Path file) {
        return extensions.contains(extensionOf(file));
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String mimeTypeOf(Path file) {
        return MIME_TYPES.getOrDefault(extensionOf(file), "application/octet-stream");
    }
}
