package com.adlanda.knowledgesync.entity;

import com.adlanda.knowledgesync.model.InsightPriority;
import com.adlanda.knowledgesync.model.InsightStatus;
import com.adlanda.knowledgesync.model.InsightType;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a structured insight extracted from a document.
 *
 * Written only by the insights worker.
 */
@Entity
@Table(name = "project_insights",
        indexes = @Index(name = "idx_project_insights_document", columnList = "source_document_id"))
public class Insight {

    @Id
    @Column(name = "id")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "insight_type", nullable = false, length = 40)
    private InsightType type;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    private InsightPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private InsightStatus status;

    @Column(name = "confidence_score")
    private double confidenceScore;

    @Column(name = "source_document_id", nullable = false, length = 500)
    private String sourceDocumentId;

    @Column(name = "project_id")
    private UUID projectId;

    @Column(name = "project_name", length = 300)
    private String projectName;

    @Column(name = "assigned_to", length = 300)
    private String assignedTo;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "keywords", length = 1000)
    private String keywords;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    protected Insight() {
    }

    public Insight(InsightType type, String title, String sourceDocumentId) {
        this.id = UUID.randomUUID();
        this.type = type;
        this.title = title;
        this.sourceDocumentId = sourceDocumentId;
        this.priority = InsightPriority.MEDIUM;
        this.status = InsightStatus.OPEN;
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public InsightType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public InsightPriority getPriority() {
        return priority;
    }

    public void setPriority(InsightPriority priority) {
        this.priority = priority;
    }

    public InsightStatus getStatus() {
        return status;
    }

    public void setStatus(InsightStatus status) {
        this.status = status;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public String getSourceDocumentId() {
        return sourceDocumentId;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public String getKeywords() {
        return keywords;
    }

    public void setKeywords(String keywords) {
        this.keywords = keywords;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
