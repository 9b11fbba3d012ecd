package com.knowledgedesk.ragbot.persistence.entity;

import com.knowledgedesk.ragbot.model.DocumentSource;
import com.knowledgedesk.ragbot.model.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.OffsetDateTime;

@Entity
@Table(name = "documents")
public class DocumentEntity {

    public static final int TITLE_MAX_LENGTH = 1024;

    @Id
    @Column(length = 128)
    private String documentId;

    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DocumentSource sourceKind;

    @Column(nullable = false, length = 2048)
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DocumentStatus status;

    @Column(length = 64)
    private String contentHash;

    @Column
    private String contentType;

    @Column
    private String modelVersion;

    @Column(nullable = false)
    private Integer chunks = 0;

    @Column(nullable = false)
    private Integer attempts = 0;

    @Column(length = 2048)
    private String failureReason;

    @Column
    private String eventId;

    @Column(nullable = false)
    private OffsetDateTime createdAt;

    @Column(nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    private Long revision;

    protected DocumentEntity() {
    }

    public DocumentEntity(String documentId, DocumentSource sourceKind, String source, String title, OffsetDateTime now) {
        this.documentId = documentId;
        this.sourceKind = sourceKind;
        this.source = source;
        this.title = title;
        this.status = DocumentStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Begins a new ingestion attempt. This is the only way back to {@link DocumentStatus#PENDING}.
     */
    public void startAttempt(String title, String eventId, OffsetDateTime now) {
        this.title = title;
        this.eventId = eventId;
        this.status = DocumentStatus.PENDING;
        this.chunks = 0;
        this.failureReason = null;
        this.attempts = attempts + 1;
        this.updatedAt = now;
    }

    public void transitionTo(DocumentStatus next, OffsetDateTime now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Document " + documentId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = now;
    }

    public void markFailed(String reason, OffsetDateTime now) {
        transitionTo(DocumentStatus.FAILED, now);
        this.chunks = 0;
        this.failureReason = reason == null || reason.length() <= 2048 ? reason : reason.substring(0, 2048);
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getTitle() {
        return title;
    }

    public DocumentSource getSourceKind() {
        return sourceKind;
    }

    public String getSource() {
        return source;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public Integer getChunks() {
        return chunks;
    }

    public void setChunks(Integer chunks) {
        this.chunks = chunks;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getEventId() {
        return eventId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
