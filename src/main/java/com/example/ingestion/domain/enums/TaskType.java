package com.example.ingestion.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Closed set of task types carried on the queue.
 * The code is the wire tag written into the stream entry's {@code type} field.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    /**
     * Download a document, extract its lines and store them
     */
    DOCUMENT_PROCESS("document:process", "Document Processing");

    private final String code;
    private final String displayName;

    /**
     * Find TaskType by its wire code
     */
    public static TaskType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type code: " + code);
    }

    /**
     * Lenient lookup used when reading entries produced by other processes.
     */
    public static Optional<TaskType> findByCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
