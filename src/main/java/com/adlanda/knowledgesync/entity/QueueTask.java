package com.adlanda.knowledgesync.entity;

import com.adlanda.knowledgesync.model.TaskStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA entity for one insights processing task.
 *
 * Status changes go through conditional updates in
 * {@link com.adlanda.knowledgesync.repository.QueueTaskRepository}, never through
 * setters on a loaded entity.
 */
@Entity
@Table(name = "insights_queue",
        indexes = @Index(name = "idx_insights_queue_status", columnList = "status, next_attempt_at"))
public class QueueTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "document_id", unique = true, nullable = false, length = 500)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    // Default constructor for JPA
    protected QueueTask() {
    }

    public QueueTask(String documentId, Instant now) {
        this.documentId = documentId;
        this.status = TaskStatus.PENDING;
        this.attempts = 0;
        this.createdAt = now;
        this.updatedAt = now;
        this.nextAttemptAt = now;
    }

    public Long getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "QueueTask{" +
                "id=" + id +
                ", documentId='" + documentId + '\'' +
                ", status=" + status +
                ", attempts=" + attempts +
                '}';
    }
}
