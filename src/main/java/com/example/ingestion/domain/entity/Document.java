package com.example.ingestion.domain.entity;

import com.example.ingestion.domain.enums.DocumentStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * An uploaded source document (PDF) awaiting or undergoing line extraction.
 * <p>
 * The catalog side of the application creates these rows; the worker only
 * moves them through PROCESSING to READY or ERROR.
 */
@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_status", columnList = "status"),
        @Index(name = "idx_documents_s3_key", columnList = "s3_key", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    /**
     * Object storage key of the uploaded file
     */
    @Column(name = "s3_key", nullable = false, length = 512)
    private String s3Key;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private DocumentStatus status = DocumentStatus.UPLOADED;

    /**
     * Last persisted page counters, e.g. {"page": 3, "total": 10}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "progress", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private Map<String, Object> progress = new HashMap<>(Map.of("page", 0, "total", 0));

    /**
     * Failure message of the last processing attempt
     */
    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void markProcessing() {
        this.status = DocumentStatus.PROCESSING;
    }

    public void markReady(int totalPages) {
        this.status = DocumentStatus.READY;
        this.processedAt = Instant.now();
        this.error = null;
        this.progress = new HashMap<>(Map.of("page", totalPages, "total", totalPages));
    }

    public void markError(String errorMessage) {
        this.status = DocumentStatus.ERROR;
        this.error = errorMessage;
    }

    public void recordProgress(int page, int total) {
        this.progress = new HashMap<>(Map.of("page", page, "total", total));
    }
}
