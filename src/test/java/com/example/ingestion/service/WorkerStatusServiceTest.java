package com.example.ingestion.service;

import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.domain.enums.WorkerState;
import com.example.ingestion.mapper.WorkerMapper;
import com.example.ingestion.mapper.WorkerMapperImpl;
import com.example.ingestion.service.handler.TaskHandlerRegistry;
import com.example.ingestion.service.queue.DeadLetterEntry;
import com.example.ingestion.service.queue.QueueStats;
import com.example.ingestion.service.queue.TaskQueue;
import com.example.ingestion.service.worker.WorkerManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkerStatusService Tests")
class WorkerStatusServiceTest {

    @Mock
    private WorkerManager workerManager;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private TaskHandlerRegistry handlerRegistry;

    private final WorkerMapper workerMapper = new WorkerMapperImpl();

    private WorkerStatusService workerStatusService;

    @BeforeEach
    void setUp() {
        workerStatusService = new WorkerStatusService(workerManager, taskQueue, handlerRegistry, workerMapper);
    }

    @Test
    @DisplayName("Should combine worker state and queue counters")
    void shouldReportStatus() {
        // Given
        when(taskQueue.stats()).thenReturn(QueueStats.builder()
                .consumerName("worker-1a2b3c4d")
                .streamLength(12)
                .pendingCount(1)
                .deadLetterCount(2)
                .build());
        when(workerManager.getState()).thenReturn(WorkerState.RUNNING);
        when(handlerRegistry.getRegisteredTypes()).thenReturn(Set.of(TaskType.DOCUMENT_PROCESS));

        // When
        var status = workerStatusService.getStatus();

        // Then
        assertThat(status.getState()).isEqualTo(WorkerState.RUNNING);
        assertThat(status.getConsumerName()).isEqualTo("worker-1a2b3c4d");
        assertThat(status.getStreamLength()).isEqualTo(12);
        assertThat(status.getPendingCount()).isEqualTo(1);
        assertThat(status.getDeadLetterCount()).isEqualTo(2);
        assertThat(status.getRegisteredTaskTypes()).containsExactly("document:process");
        assertThat(status.getGeneratedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should list dead letters as returned by the queue")
    void shouldListDeadLetters() {
        var failedAt = Instant.parse("2026-03-01T12:00:00Z");
        when(taskQueue.deadLetters(10)).thenReturn(List.of(DeadLetterEntry.builder()
                .entryId("9-0")
                .originalId("task-1")
                .type("document:process")
                .payload("{\"document_id\":42}")
                .error("Document 42 not found")
                .failedAt(failedAt)
                .build()));

        var deadLetters = workerStatusService.getDeadLetters(10);

        assertThat(deadLetters).hasSize(1);
        assertThat(deadLetters.get(0).getOriginalId()).isEqualTo("task-1");
        assertThat(deadLetters.get(0).getError()).isEqualTo("Document 42 not found");
        assertThat(deadLetters.get(0).getFailedAt()).isEqualTo(failedAt);
    }
}
