package com.example.ingestion.domain.enums;

/**
 * Worker manager lifecycle. STOPPED is terminal.
 */
public enum WorkerState {
    NOT_STARTED,
    RUNNING,
    STOPPING,
    STOPPED
}
