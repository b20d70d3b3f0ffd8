package com.adlanda.knowledgesync.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA entity for an ingested document.
 *
 * Keeps the extracted text so the insights worker can read it without going back to the source.
 */
@Entity
@Table(name = "source_documents")
public class SourceDocument {

    @Id
    @Column(name = "id", length = 500)
    private String id;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "path", length = 1000)
    private String path;

    @Column(name = "mime_type", length = 200)
    private String mimeType;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(name = "ingested_at")
    private Instant ingestedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Default constructor for JPA
    protected SourceDocument() {
    }

    public SourceDocument(String id) {
        this.id = id;
        this.ingestedAt = Instant.now();
        this.updatedAt = this.ingestedAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }

    public void setChunkCount(Integer chunkCount) {
        this.chunkCount = chunkCount;
    }

    public Instant getIngestedAt() {
        return ingestedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "SourceDocument{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", chunkCount=" + chunkCount +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
