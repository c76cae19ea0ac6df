package com.example.ingestion.exception;

import lombok.Getter;

/**
 * Exception for document not found
 */
@Getter
public class DocumentNotFoundException extends RuntimeException {

    private final Long documentId;

    public DocumentNotFoundException(Long documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
