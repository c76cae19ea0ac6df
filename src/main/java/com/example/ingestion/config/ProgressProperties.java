package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "progress")
public class ProgressProperties {

    @NotBlank
    private String keyPrefix = "ingestion:progress:";

    @NotBlank
    private String channelPrefix = "ingestion:progress:updates:";

    @Min(1)
    private long ttlSeconds = 3600;
}
