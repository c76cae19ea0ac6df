package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis stream names and retry policy of the task queue.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-queue")
public class QueueProperties {

    @NotBlank
    private String streamKey = "ingestion:tasks";

    @NotBlank
    private String groupName = "ingestion:workers";

    @NotBlank
    private String dlqKey = "ingestion:tasks:dlq";

    /**
     * Attempts after which a retryable failure is dead-lettered
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * Delay before each retry attempt; the last value repeats
     */
    @NotEmpty
    private List<Long> retryDelaysSeconds = new ArrayList<>(List.of(5L, 30L, 120L));

    public long retryDelaySecondsFor(int retryCount) {
        var index = Math.min(Math.max(retryCount, 0), retryDelaysSeconds.size() - 1);
        return retryDelaysSeconds.get(index);
    }
}
