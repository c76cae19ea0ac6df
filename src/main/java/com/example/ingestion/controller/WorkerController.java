package com.example.ingestion.controller;

import com.example.ingestion.dto.ApiResponse;
import com.example.ingestion.dto.DeadLetterResponse;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.service.WorkerStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/worker")
@Tag(name = "Worker", description = "Worker status and dead-letter inspection")
public class WorkerController {

    private final WorkerStatusService workerStatusService;

    @GetMapping("/status")
    @Operation(summary = "Worker status", description = "Run loop state and queue depths")
    public ResponseEntity<ApiResponse<WorkerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(workerStatusService.getStatus()));
    }

    @GetMapping("/dead-letters")
    @Operation(summary = "Dead-lettered tasks", description = "Newest entries of the dead-letter stream")
    public ResponseEntity<ApiResponse<List<DeadLetterResponse>>> getDeadLetters(
            @Parameter(description = "Maximum number of entries")
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(ApiResponse.success(workerStatusService.getDeadLetters(limit)));
    }
}
