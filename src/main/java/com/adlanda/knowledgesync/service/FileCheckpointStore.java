package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Local JSON file holding a checkpoint while the database is unreachable.
 *
 * <p>Format:
 * <pre>
 * {
 *   "checkpointKey": "local:/data/docs",
 *   "lastCheckTime": "2024-05-01T10:00:00Z",
 *   "knownItems": { "&lt;itemId&gt;": { "itemId": "...", "path": "...", "version": "...", "size": 0 }, ... }
 * }
 * </pre>
 * Writes go to a sibling temp file that is then moved over the target, so a crash leaves
 * either the old or the new file, never a truncated one.
 */
public class FileCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;

    public record PersistedCheckpoint(
            String checkpointKey,
            Instant lastCheckTime,
            Map<String, ItemFingerprint> knownItems) {}

    public FileCheckpointStore(Path stateFile, ObjectMapper objectMapper) {
        this.stateFile = stateFile;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the checkpoint stored for the given key.
     *
     * @return empty if the file does not exist or belongs to another source/root
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public Optional<SyncCheckpoint> read(String checkpointKey) throws IOException {
        if (!Files.exists(stateFile)) {
            return Optional.empty();
        }
        PersistedCheckpoint persisted = objectMapper.readValue(stateFile.toFile(), PersistedCheckpoint.class);
        if (!checkpointKey.equals(persisted.checkpointKey())) {
            log.info("Ignoring fallback state file {} written for {}", stateFile, persisted.checkpointKey());
            return Optional.empty();
        }
        return Optional.of(new SyncCheckpoint(persisted.lastCheckTime(), persisted.knownItems()));
    }

    public void write(String checkpointKey, SyncCheckpoint checkpoint) throws IOException {
        Path parent = stateFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        PersistedCheckpoint persisted = new PersistedCheckpoint(
                checkpointKey, checkpoint.lastCheckTime(), checkpoint.knownItems());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), persisted);
        Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Removes the file once the database holds an up-to-date checkpoint again.
     */
    public void deleteIfPresent() {
        try {
            if (Files.deleteIfExists(stateFile)) {
                log.info("Removed fallback state file {} after durable save", stateFile);
            }
        } catch (IOException e) {
            log.warn("Could not remove fallback state file {}: {}", stateFile, e.getMessage());
        }
    }

    public Path getStateFile() {
        return stateFile;
    }
}
