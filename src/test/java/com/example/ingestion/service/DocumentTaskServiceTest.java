package com.example.ingestion.service;

import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.domain.repository.DocumentRepository;
import com.example.ingestion.exception.DocumentNotFoundException;
import com.example.ingestion.exception.TaskEnqueueException;
import com.example.ingestion.service.progress.ProgressTracker;
import com.example.ingestion.service.queue.TaskQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentTaskService Tests")
class DocumentTaskServiceTest {

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private ProgressTracker progressTracker;

    @InjectMocks
    private DocumentTaskService documentTaskService;

    @Nested
    @DisplayName("enqueueProcessing")
    class EnqueueTests {

        @Test
        @DisplayName("Should enqueue a processing task for an existing document")
        void shouldEnqueue() {
            // Given
            when(documentRepository.existsById(42L)).thenReturn(true);
            when(taskQueue.enqueue(TaskType.DOCUMENT_PROCESS, Map.of("document_id", 42L))).thenReturn("task-1");

            // When
            var taskId = documentTaskService.enqueueProcessing(42L);

            // Then
            assertThat(taskId).isEqualTo("task-1");
            var inOrder = inOrder(progressTracker, taskQueue);
            inOrder.verify(progressTracker).clear(42L);
            inOrder.verify(taskQueue).enqueue(TaskType.DOCUMENT_PROCESS, Map.of("document_id", 42L));
        }

        @Test
        @DisplayName("Should reject unknown documents")
        void shouldRejectUnknownDocument() {
            when(documentRepository.existsById(7L)).thenReturn(false);

            assertThatThrownBy(() -> documentTaskService.enqueueProcessing(7L))
                    .isInstanceOf(DocumentNotFoundException.class)
                    .hasMessage("Document not found: 7");

            verifyNoInteractions(taskQueue, progressTracker);
        }

        @Test
        @DisplayName("Should report an unreachable queue")
        void shouldWrapQueueErrors() {
            when(documentRepository.existsById(42L)).thenReturn(true);
            when(taskQueue.enqueue(any(), any())).thenThrow(new RedisConnectionFailureException("Connection refused"));

            assertThatThrownBy(() -> documentTaskService.enqueueProcessing(42L))
                    .isInstanceOf(TaskEnqueueException.class)
                    .hasMessage("Failed to enqueue document:process task: Connection refused");
        }
    }
}
