package com.example.ingestion.dto;

import com.example.ingestion.domain.enums.WorkerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Worker and queue status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatusResponse {

    private WorkerState state;
    private String consumerName;
    private long streamLength;
    private long pendingCount;
    private long deadLetterCount;
    private Set<String> registeredTaskTypes;
    private Instant generatedAt;
}
