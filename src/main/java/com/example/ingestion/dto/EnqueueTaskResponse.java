package com.example.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of a processing request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueTaskResponse {

    private String taskId;
    private String taskType;
    private Long documentId;
}
