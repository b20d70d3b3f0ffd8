package com.adlanda.knowledgesync.repository;

import com.adlanda.knowledgesync.entity.QueueTask;
import com.adlanda.knowledgesync.model.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for insights queue tasks.
 *
 * Every status change is a conditional update that names the expected current status,
 * so concurrent callers racing on the same row see exactly one winner (affected rows = 1).
 */
@Repository
public interface QueueTaskRepository extends JpaRepository<QueueTask, Long> {

    Optional<QueueTask> findByDocumentId(String documentId);

    /**
     * Oldest tasks in the given status that are due for an attempt.
     */
    @Query("SELECT t.id FROM QueueTask t WHERE t.status = :status AND t.nextAttemptAt <= :now " +
            "ORDER BY t.createdAt ASC, t.id ASC")
    List<Long> findDueIds(TaskStatus status, Instant now, Pageable pageable);

    /**
     * Moves a task from one status to another if it is still in the expected status.
     *
     * @return 1 if this caller made the transition, 0 if someone else got there first
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE QueueTask t SET t.status = :to, t.updatedAt = :now " +
            "WHERE t.id = :id AND t.status = :from")
    int transition(Long id, TaskStatus from, TaskStatus to, Instant now);

    /**
     * Records a failed attempt on a task currently being processed.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE QueueTask t SET t.status = :to, t.attempts = :attempts, t.lastError = :error, " +
            "t.nextAttemptAt = :nextAttemptAt, t.updatedAt = :now " +
            "WHERE t.id = :id AND t.status = :from")
    int recordFailure(Long id, TaskStatus from, TaskStatus to, int attempts, String error,
                      Instant nextAttemptAt, Instant now);

    /**
     * Returns a failed task to pending with a fresh attempt budget.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE QueueTask t SET t.status = :to, t.attempts = 0, t.lastError = NULL, " +
            "t.nextAttemptAt = :now, t.updatedAt = :now WHERE t.status = :from")
    int resetAll(TaskStatus from, TaskStatus to, Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE QueueTask t SET t.status = :to, t.attempts = 0, t.lastError = NULL, " +
            "t.nextAttemptAt = :now, t.updatedAt = :now WHERE t.id = :id AND t.status = :from")
    int reset(Long id, TaskStatus from, TaskStatus to, Instant now);

    /**
     * Returns tasks abandoned in processing (worker crashed or timed out) to pending.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE QueueTask t SET t.status = :to, t.nextAttemptAt = :now, t.updatedAt = :now " +
            "WHERE t.status = :from AND t.updatedAt < :cutoff")
    int reclaimStale(TaskStatus from, TaskStatus to, Instant cutoff, Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QueueTask t WHERE t.documentId = :documentId")
    int deleteByDocumentId(String documentId);

    @Query("SELECT t.status, COUNT(t) FROM QueueTask t GROUP BY t.status")
    List<Object[]> countGroupedByStatus();

    @Query("SELECT MIN(t.createdAt) FROM QueueTask t WHERE t.status = :status")
    Optional<Instant> findOldestCreatedAt(TaskStatus status);
}
