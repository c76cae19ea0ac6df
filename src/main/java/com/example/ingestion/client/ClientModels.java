package com.example.ingestion.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Mathpix PDF API Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PdfSubmitRequest {
        private String url;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PdfSubmitResponse {
        @JsonProperty("pdf_id")
        private String pdfId;
        private String error;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PdfStatusResponse {
        private String status;

        @JsonProperty("num_pages")
        private Integer numPages;

        @JsonProperty("num_pages_completed")
        private Integer numPagesCompleted;

        @JsonProperty("percent_done")
        private Double percentDone;

        private String error;

        public boolean isCompleted() {
            return "completed".equalsIgnoreCase(status);
        }

        public boolean isFailed() {
            return "error".equalsIgnoreCase(status);
        }
    }

    /**
     * Line-by-line result of a processed PDF
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractedLines {
        @Builder.Default
        private List<PageLines> pages = new ArrayList<>();
    }

    /**
     * Lines of one page. Each line is kept as the raw JSON object so that
     * every attribute the service returns can be stored as metadata.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PageLines {
        @Builder.Default
        private int page = 1;

        @Builder.Default
        private List<Map<String, Object>> lines = new ArrayList<>();
    }
}
