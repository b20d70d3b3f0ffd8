package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.entity.CheckpointRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Durable storage for sync checkpoints, keyed by source and watch root.
 */
@Repository
public interface CheckpointRecordRepository extends JpaRepository<CheckpointRecord, String> {
}
