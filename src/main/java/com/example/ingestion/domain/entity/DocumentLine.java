package com.example.ingestion.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * One extracted line of a document page, as returned by the line extraction service.
 */
@Entity
@Table(name = "document_lines",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_document_lines_document_page_line",
                columnNames = {"document_id", "page_number", "line_number"}),
        indexes = {
                @Index(name = "idx_document_lines_document_id", columnList = "document_id"),
                @Index(name = "idx_document_lines_line_type", columnList = "line_type")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentLine {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_MATH = "math";
    public static final String TYPE_SECTION_HEADER = "section_header";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private Long documentId;

    /**
     * 1-based page number
     */
    @Column(name = "page_number", nullable = false)
    private Integer pageNumber;

    /**
     * 1-based position within the page
     */
    @Column(name = "line_number", nullable = false)
    private Integer lineNumber;

    @Column(name = "text", nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(name = "line_type", nullable = false, length = 50)
    private String lineType;

    @Column(name = "font_size")
    private Integer fontSize;

    @Column(name = "is_printed", nullable = false)
    @Builder.Default
    private boolean printed = true;

    @Column(name = "is_handwritten", nullable = false)
    @Builder.Default
    private boolean handwritten = false;

    @Column(name = "confidence")
    private Double confidence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "region", columnDefinition = "jsonb")
    private Map<String, Object> region;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_metadata", columnDefinition = "jsonb")
    private Map<String, Object> rawMetadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
