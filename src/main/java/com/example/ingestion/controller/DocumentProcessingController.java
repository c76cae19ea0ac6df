package com.example.ingestion.controller;

import com.example.ingestion.domain.enums.ProgressStatus;
import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.dto.ApiResponse;
import com.example.ingestion.dto.EnqueueTaskResponse;
import com.example.ingestion.service.DocumentTaskService;
import com.example.ingestion.service.progress.Progress;
import com.example.ingestion.service.progress.ProgressTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Thin HTTP seam over the document processing queue and its progress channel.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/documents")
@Tag(name = "Document Processing", description = "Queue documents for line extraction and follow their progress")
public class DocumentProcessingController {

    private final DocumentTaskService documentTaskService;
    private final ProgressTracker progressTracker;

    @PostMapping("/{documentId}/process")
    @Operation(summary = "Process a document", description = "Queue a document for line extraction")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ResponseEntity<ApiResponse<EnqueueTaskResponse>> processDocument(
            @Parameter(description = "Document ID") @PathVariable long documentId) {
        log.info("API: Process document {}", documentId);

        var taskId = documentTaskService.enqueueProcessing(documentId);
        var response = EnqueueTaskResponse.builder()
                .taskId(taskId)
                .taskType(TaskType.DOCUMENT_PROCESS.getCode())
                .documentId(documentId)
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Document queued for processing"));
    }

    @GetMapping("/{documentId}/progress")
    @Operation(summary = "Get progress", description = "Last progress snapshot of a document")
    public ResponseEntity<ApiResponse<Progress>> getProgress(
            @Parameter(description = "Document ID") @PathVariable long documentId) {
        return progressTracker.get(documentId)
                .map(progress -> ResponseEntity.ok(ApiResponse.success(progress)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Current snapshot followed by live updates, ending after the first ready or error update.
     */
    @GetMapping(value = "/{documentId}/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream progress", description = "Server-Sent Events with progress updates of a document")
    public Flux<ServerSentEvent<Progress>> streamProgress(
            @Parameter(description = "Document ID") @PathVariable long documentId) {
        var snapshot = Mono.fromCallable(() -> progressTracker.get(documentId))
                .flatMap(Mono::justOrEmpty);

        return Flux.concat(snapshot, progressTracker.subscribe(documentId))
                .takeUntil(progress -> progress.getStatus() != ProgressStatus.PROCESSING)
                .map(progress -> ServerSentEvent.<Progress>builder()
                        .event("progress")
                        .data(progress)
                        .build())
                .doOnCancel(() -> log.debug("Progress stream for document {} closed by client", documentId));
    }
}
