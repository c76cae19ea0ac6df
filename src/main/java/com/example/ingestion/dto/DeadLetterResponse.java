package com.example.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterResponse {

    private String entryId;
    private String originalId;
    private String type;

    /**
     * Payload JSON exactly as it was on the task stream
     */
    private String payload;

    private String error;
    private Instant failedAt;
}
