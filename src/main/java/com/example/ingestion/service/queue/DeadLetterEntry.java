package com.example.ingestion.service.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A permanently failed task as stored on the dead-letter stream.
 */
@Value
@Builder
public class DeadLetterEntry {
    String entryId;
    String originalId;
    String type;
    String payload;
    String error;
    Instant failedAt;
}
