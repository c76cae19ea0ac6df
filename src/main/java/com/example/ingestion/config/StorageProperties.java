package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * S3 compatible object storage holding uploaded documents.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "storage.s3")
public class StorageProperties {

    /**
     * Custom endpoint for S3 compatible stores (MinIO); empty for AWS
     */
    private String endpoint;

    @NotBlank
    private String region = "us-east-1";

    @NotBlank
    private String bucket = "documents";

    private String accessKey;

    private String secretKey;

    private boolean pathStyleAccess = true;

    /**
     * Lifetime of presigned download URLs handed to the extraction service
     */
    @Min(60)
    private long urlExpirySeconds = 3600;
}
