package com.example.ingestion.service.progress;

import com.example.ingestion.domain.enums.ProgressStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last known state of a long running item, e.g. pages processed of a document.
 * Serialised as {@code {subject_id, page, total, status, message}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Progress {

    @JsonProperty("subject_id")
    private long subjectId;

    private int page;

    private int total;

    private ProgressStatus status;

    private String message;

    public static Progress processing(long subjectId, int page, int total, String message) {
        return new Progress(subjectId, page, total, ProgressStatus.PROCESSING, message);
    }

    public static Progress ready(long subjectId, int total) {
        return new Progress(subjectId, total, total, ProgressStatus.READY, "Processing complete");
    }

    public static Progress error(long subjectId, String message) {
        return new Progress(subjectId, 0, 0, ProgressStatus.ERROR, message);
    }
}
