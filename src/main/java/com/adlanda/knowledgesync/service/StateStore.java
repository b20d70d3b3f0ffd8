package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.config.SyncProperties;
import com.adlanda.knowledgesync.entity.CheckpointRecord;
import com.adlanda.knowledgesync.exception.StateStoreException;
import com.adlanda.knowledgesync.model.ItemFingerprint;
import com.adlanda.knowledgesync.model.SyncCheckpoint;
import com.adlanda.knowledgesync.repository.CheckpointRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads and saves sync checkpoints.
 *
 * The database row is the primary copy. When the database cannot be reached the
 * checkpoint goes to a local JSON file instead and the store runs in degraded mode
 * until the next successful durable save.
 */
@Service
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private static final TypeReference<Map<String, ItemFingerprint>> KNOWN_ITEMS_TYPE = new TypeReference<>() {};

    /**
     * Where a checkpoint ended up.
     */
    public enum SaveOutcome {
        DURABLE,
        DEGRADED
    }

    private final CheckpointRecordRepository repository;
    private final FileCheckpointStore fallback;
    private final ObjectMapper objectMapper;
    private final String checkpointKey;

    @Autowired
    public StateStore(CheckpointRecordRepository repository, SyncProperties properties, ObjectMapper objectMapper) {
        this(repository,
                new FileCheckpointStore(Path.of(properties.getStateFile()), objectMapper),
                objectMapper,
                properties.checkpointKey());
    }

    StateStore(CheckpointRecordRepository repository, FileCheckpointStore fallback,
               ObjectMapper objectMapper, String checkpointKey) {
        this.repository = repository;
        this.fallback = fallback;
        this.objectMapper = objectMapper;
        this.checkpointKey = checkpointKey;
    }

    /**
     * Returns the most recent checkpoint, or an empty one if none was ever saved.
     *
     * @throws StateStoreException if neither the database nor the fallback file can be read
     */
    public SyncCheckpoint load() {
        Optional<SyncCheckpoint> durable = Optional.empty();
        boolean durableReachable = true;
        try {
            durable = repository.findById(checkpointKey).map(this::fromRecord);
        } catch (DataAccessException e) {
            durableReachable = false;
            log.warn("Checkpoint database unreachable, loading from fallback file {} (degraded mode): {}",
                    fallback.getStateFile(), e.getMessage());
        }

        Optional<SyncCheckpoint> local;
        try {
            local = fallback.read(checkpointKey);
        } catch (IOException e) {
            if (!durableReachable) {
                throw new StateStoreException("Checkpoint unavailable: database unreachable and fallback file unreadable", e);
            }
            log.warn("Ignoring unreadable fallback state file {}: {}", fallback.getStateFile(), e.getMessage());
            local = Optional.empty();
        }

        SyncCheckpoint checkpoint = Stream.of(durable, local)
                .flatMap(Optional::stream)
                .max(Comparator.comparing(SyncCheckpoint::lastCheckTime,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseGet(SyncCheckpoint::empty);

        if (checkpoint.isEmpty()) {
            log.info("No checkpoint stored for {}, next cycle is an initial scan", checkpointKey);
        } else {
            log.debug("Loaded checkpoint for {}: {} known items, last check {}",
                    checkpointKey, checkpoint.knownItems().size(), checkpoint.lastCheckTime());
        }
        return checkpoint;
    }

    /**
     * Replaces the stored checkpoint.
     *
     * @return DEGRADED if only the fallback file could be written
     * @throws StateStoreException if neither target could be written
     */
    public SaveOutcome save(SyncCheckpoint checkpoint) {
        try {
            CheckpointRecord record = new CheckpointRecord(
                    checkpointKey,
                    checkpoint.lastCheckTime(),
                    objectMapper.writeValueAsString(checkpoint.knownItems()),
                    checkpoint.knownItems().size());
            repository.save(record);
            fallback.deleteIfPresent();
            return SaveOutcome.DURABLE;
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Checkpoint is not serializable", e);
        } catch (DataAccessException e) {
            log.warn("Checkpoint database unreachable, writing fallback file {} (degraded mode): {}",
                    fallback.getStateFile(), e.getMessage());
        }

        try {
            fallback.write(checkpointKey, checkpoint);
            return SaveOutcome.DEGRADED;
        } catch (IOException e) {
            throw new StateStoreException("Checkpoint could not be saved to database or fallback file", e);
        }
    }

    private SyncCheckpoint fromRecord(CheckpointRecord record) {
        try {
            Map<String, ItemFingerprint> items = objectMapper.readValue(record.getKnownItemsJson(), KNOWN_ITEMS_TYPE);
            return new SyncCheckpoint(record.getLastCheckTime(), items);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Stored checkpoint " + record.getCheckpointKey() + " is corrupted", e);
        }
    }

    String getCheckpointKey() {
        return checkpointKey;
    }
}
