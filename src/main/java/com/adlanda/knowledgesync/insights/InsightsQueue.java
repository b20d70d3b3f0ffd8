package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.entity.QueueTask;
import com.adlanda.knowledgesync.model.QueueStats;
import com.adlanda.knowledgesync.model.TaskStatus;
import com.adlanda.knowledgesync.repository.QueueTaskRepository;
import com.adlanda.knowledgesync.repository.SourceDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of insight-generation tasks, one per document.
 *
 * Status transitions are conditional updates on the expected current status:
 * <pre>
 *   PENDING --claimNext--&gt; PROCESSING --complete--&gt; COMPLETED
 *                          PROCESSING --fail------&gt; PENDING (attempts &lt; max, after backoff)
 *                          PROCESSING --fail------&gt; FAILED  (attempts = max)
 *   FAILED --resetFailed--&gt; PENDING (attempts = 0)
 *   PROCESSING --resetStaleProcessing--&gt; PENDING
 * </pre>
 */
@Service
public class InsightsQueue {

    private static final Logger log = LoggerFactory.getLogger(InsightsQueue.class);

    private static final int CLAIM_CANDIDATES = 5;
    private static final int MAX_ERROR_LENGTH = 2000;

    private final QueueTaskRepository taskRepository;
    private final SourceDocumentRepository documentRepository;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public InsightsQueue(QueueTaskRepository taskRepository,
                         SourceDocumentRepository documentRepository,
                         InsightsProperties properties,
                         Clock clock) {
        this.taskRepository = taskRepository;
        this.documentRepository = documentRepository;
        this.retryPolicy = new RetryPolicy(
                properties.getWorker().getMaxAttempts(),
                properties.getWorker().getBackoffBase(),
                properties.getWorker().getMaxBackoff());
        this.clock = clock;
    }

    /**
     * Queues a document for insight generation.
     *
     * No-op if the document already has a pending, processing or completed task.
     * A failed task is reset to pending with a fresh attempt budget.
     *
     * @return true if a task became pending because of this call
     */
    public boolean enqueue(String documentId) {
        Instant now = clock.instant();
        Optional<QueueTask> existing = taskRepository.findByDocumentId(documentId);
        if (existing.isPresent()) {
            QueueTask task = existing.get();
            if (task.getStatus() == TaskStatus.FAILED) {
                boolean reset = taskRepository.reset(task.getId(), TaskStatus.FAILED, TaskStatus.PENDING, now) == 1;
                if (reset) {
                    log.info("Re-queued failed task {} for document {}", task.getId(), documentId);
                }
                return reset;
            }
            log.debug("Document {} already queued ({})", documentId, task.getStatus());
            return false;
        }

        try {
            QueueTask task = taskRepository.saveAndFlush(new QueueTask(documentId, now));
            log.debug("Queued task {} for document {}", task.getId(), documentId);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Another caller inserted the same document first
            log.debug("Document {} queued concurrently", documentId);
            return false;
        }
    }

    /**
     * Atomically moves one due pending task to processing.
     *
     * Candidates are read first; each claim is a single conditional update that only one
     * caller can win. Losers move on to the next candidate.
     */
    @Transactional
    public Optional<QueueTask> claimNext() {
        Instant now = clock.instant();
        List<Long> candidates = taskRepository.findDueIds(TaskStatus.PENDING, now, PageRequest.of(0, CLAIM_CANDIDATES));

        for (Long id : candidates) {
            if (taskRepository.transition(id, TaskStatus.PENDING, TaskStatus.PROCESSING, now) == 1) {
                return taskRepository.findById(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Marks a processing task completed.
     *
     * @return false if the task was not in processing (e.g. reclaimed as stale)
     */
    @Transactional
    public boolean complete(Long taskId) {
        boolean completed = taskRepository.transition(
                taskId, TaskStatus.PROCESSING, TaskStatus.COMPLETED, clock.instant()) == 1;
        if (!completed) {
            log.warn("Task {} was not processing, completion ignored", taskId);
        }
        return completed;
    }

    /**
     * Records a failed attempt: back to pending after a backoff delay, or failed once attempts are exhausted.
     *
     * @return the status the task ended up in, empty if it was not processing
     */
    @Transactional
    public Optional<TaskStatus> fail(Long taskId, String error) {
        Optional<QueueTask> found = taskRepository.findById(taskId);
        if (found.isEmpty() || found.get().getStatus() != TaskStatus.PROCESSING) {
            log.warn("Task {} was not processing, failure ignored", taskId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        int attempts = found.get().getAttempts() + 1;
        TaskStatus next = retryPolicy.isExhausted(attempts) ? TaskStatus.FAILED : TaskStatus.PENDING;
        Instant nextAttemptAt = next == TaskStatus.PENDING ? now.plus(retryPolicy.delayAfter(attempts)) : now;

        int updated = taskRepository.recordFailure(taskId, TaskStatus.PROCESSING, next, attempts,
                truncate(error), nextAttemptAt, now);
        if (updated == 0) {
            log.warn("Task {} left processing concurrently, failure ignored", taskId);
            return Optional.empty();
        }

        if (next == TaskStatus.FAILED) {
            log.error("Task {} failed permanently after {} attempts: {}", taskId, attempts, error);
        } else {
            log.warn("Task {} failed (attempt {}/{}), retry at {}: {}",
                    taskId, attempts, retryPolicy.maxAttempts(), nextAttemptAt, error);
        }
        return Optional.of(next);
    }

    public QueueStats stats() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (Object[] row : taskRepository.countGroupedByStatus()) {
            counts.put((TaskStatus) row[0], ((Number) row[1]).longValue());
        }

        Duration oldestPendingAge = taskRepository.findOldestCreatedAt(TaskStatus.PENDING)
                .map(createdAt -> Duration.between(createdAt, clock.instant()))
                .orElse(null);

        return new QueueStats(
                counts.getOrDefault(TaskStatus.PENDING, 0L),
                counts.getOrDefault(TaskStatus.PROCESSING, 0L),
                counts.getOrDefault(TaskStatus.COMPLETED, 0L),
                counts.getOrDefault(TaskStatus.FAILED, 0L),
                oldestPendingAge);
    }

    /**
     * Drops the task of a document that no longer exists, whatever its status,
     * so the document is queued afresh if it comes back.
     *
     * @return true if a task was deleted
     */
    public boolean forget(String documentId) {
        boolean deleted = taskRepository.deleteByDocumentId(documentId) > 0;
        if (deleted) {
            log.debug("Dropped queue task of removed document {}", documentId);
        }
        return deleted;
    }

    /**
     * Returns every failed task to pending with attempts reset to 0.
     */
    @Transactional
    public int resetFailed() {
        int reset = taskRepository.resetAll(TaskStatus.FAILED, TaskStatus.PENDING, clock.instant());
        log.info("Reset {} failed tasks to pending", reset);
        return reset;
    }

    /**
     * Queues every ingested document that never had a task.
     */
    public int queueUnprocessed() {
        int queued = 0;
        for (String documentId : documentRepository.findIdsWithoutQueueTask()) {
            if (enqueue(documentId)) {
                queued++;
            }
        }
        log.info("Retroactively queued {} documents", queued);
        return queued;
    }

    /**
     * Returns tasks stuck in processing for longer than {@code staleAfter} to pending.
     * Attempts are left unchanged.
     */
    @Transactional
    public int resetStaleProcessing(Duration staleAfter) {
        Instant now = clock.instant();
        int reclaimed = taskRepository.reclaimStale(TaskStatus.PROCESSING, TaskStatus.PENDING, now.minus(staleAfter), now);
        if (reclaimed > 0) {
            log.warn("Reclaimed {} tasks stuck in processing for more than {}", reclaimed, staleAfter);
        }
        return reclaimed;
    }

    RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
