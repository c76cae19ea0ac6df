package com.example.ingestion.domain.enums;

/**
 * Lifecycle of an uploaded document.
 */
public enum DocumentStatus {
    PENDING,
    UPLOADED,
    PROCESSING,
    READY,
    ERROR
}
