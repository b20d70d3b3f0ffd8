package com.adlanda.knowledgesync.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA entity holding the durable copy of a sync checkpoint.
 *
 * One row per source and watch root. The known-item index is stored as a JSON document
 * so the whole checkpoint is swapped in a single row update.
 */
@Entity
@Table(name = "sync_checkpoints")
public class CheckpointRecord {

    @Id
    @Column(name = "checkpoint_key", length = 600)
    private String checkpointKey;

    @Column(name = "last_check_time")
    private Instant lastCheckTime;

    @Column(name = "known_items", nullable = false, columnDefinition = "text")
    private String knownItemsJson;

    @Column(name = "item_count")
    private Integer itemCount;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Default constructor for JPA
    protected CheckpointRecord() {
    }

    public CheckpointRecord(String checkpointKey, Instant lastCheckTime, String knownItemsJson, int itemCount) {
        this.checkpointKey = checkpointKey;
        this.lastCheckTime = lastCheckTime;
        this.knownItemsJson = knownItemsJson;
        this.itemCount = itemCount;
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public String getCheckpointKey() {
        return checkpointKey;
    }

    public Instant getLastCheckTime() {
        return lastCheckTime;
    }

    public void setLastCheckTime(Instant lastCheckTime) {
        this.lastCheckTime = lastCheckTime;
    }

    public String getKnownItemsJson() {
        return knownItemsJson;
    }

    public void setKnownItemsJson(String knownItemsJson) {
        this.knownItemsJson = knownItemsJson;
    }

    public Integer getItemCount() {
        return itemCount;
    }

    public void setItemCount(Integer itemCount) {
        this.itemCount = itemCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "CheckpointRecord{" +
                "checkpointKey='" + checkpointKey + '\'' +
                ", lastCheckTime=" + lastCheckTime +
                ", itemCount=" + itemCount +
                '}';
    }
}
