package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Deadlines of the document processing handler.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "document-processing")
public class DocumentProcessingProperties {

    /**
     * Overall deadline of one document task
     */
    @Min(1)
    private int timeoutSeconds = 600;

    @Min(1)
    private int downloadTimeoutSeconds = 120;

    @Min(1)
    private int parseTimeoutSeconds = 60;

    @Min(1)
    private int extractionTimeoutSeconds = 600;

    /**
     * Pause between pages while storing lines
     */
    @Min(0)
    private long pageDelayMs = 0;
}
