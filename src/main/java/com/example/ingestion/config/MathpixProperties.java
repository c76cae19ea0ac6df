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
@ConfigurationProperties(prefix = "external-services.mathpix")
public class MathpixProperties {

    @NotBlank
    private String baseUrl = "https://api.mathpix.com/v3";

    private String appId;

    private String appKey;

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(100)
    private long pollIntervalMs = 5000;

    @Min(1)
    private int maxPolls = 120;

    public boolean isConfigured() {
        return appId != null && !appId.isBlank() && appKey != null && !appKey.isBlank();
    }
}
