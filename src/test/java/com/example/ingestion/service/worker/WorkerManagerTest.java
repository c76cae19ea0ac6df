package com.example.ingestion.service.worker;

import com.example.ingestion.config.MetricsConfig;
import com.example.ingestion.config.WorkerProperties;
import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.domain.enums.WorkerState;
import com.example.ingestion.exception.TaskException;
import com.example.ingestion.service.alert.SlackAlertService;
import com.example.ingestion.service.handler.CancellationToken;
import com.example.ingestion.service.handler.TaskHandler;
import com.example.ingestion.service.handler.TaskHandlerRegistry;
import com.example.ingestion.service.queue.RetryOutcome;
import com.example.ingestion.service.queue.Task;
import com.example.ingestion.service.queue.TaskQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkerManager Tests")
class WorkerManagerTest {

    private static final String TYPE = TaskType.DOCUMENT_PROCESS.getCode();

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private TaskHandlerRegistry handlerRegistry;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private TaskHandler handler;

    private WorkerProperties properties;
    private WorkerManager workerManager;
    private Task task;

    @BeforeEach
    void setUp() {
        properties = new WorkerProperties();
        properties.setBlockMs(100);
        properties.setShutdownTimeoutSeconds(5);
        workerManager = new WorkerManager(taskQueue, handlerRegistry, slackAlertService, metricsConfig, properties);
        task = Task.builder()
                .id("task-1")
                .type(TYPE)
                .payload(Map.of("document_id", 42))
                .deliveryToken("1700000000000-0")
                .build();
    }

    @AfterEach
    void tearDown() {
        workerManager.stop();
    }

    @Nested
    @DisplayName("Task outcomes")
    class OutcomeTests {

        @BeforeEach
        void setUpHandler() {
            when(handlerRegistry.getHandler(TYPE)).thenReturn(Optional.of(handler));
        }

        @Test
        @DisplayName("Should acknowledge a successful task")
        void shouldAckOnSuccess() {
            // When
            workerManager.processTask(task);

            // Then
            verify(handler).execute(eq(task), any(CancellationToken.class));
            verify(taskQueue).ack(task);
            verify(taskQueue, never()).retry(any(), anyString());
            verify(taskQueue, never()).fail(any(), anyString());
            verify(metricsConfig).recordCompleted(TYPE);
        }

        @Test
        @DisplayName("Should schedule a retry for a retryable failure")
        void shouldRetryRetryableFailure() {
            // Given
            doThrow(TaskException.retryable("S3 download timeout")).when(handler).execute(eq(task), any());
            when(taskQueue.retry(task, "S3 download timeout")).thenReturn(RetryOutcome.SCHEDULED);

            // When
            workerManager.processTask(task);

            // Then
            verify(taskQueue, never()).ack(any());
            verify(taskQueue, never()).fail(any(), anyString());
            verify(metricsConfig).recordRetry(TYPE, 1);
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should alert when the last retry is dead-lettered")
        void shouldAlertWhenRetriesExhausted() {
            var lastAttempt = task.toBuilder().retryCount(2).build();
            doThrow(TaskException.retryable("Line extraction timeout")).when(handler).execute(eq(lastAttempt), any());
            when(taskQueue.retry(lastAttempt, "Line extraction timeout")).thenReturn(RetryOutcome.DEAD_LETTERED);

            workerManager.processTask(lastAttempt);

            verify(metricsConfig).recordDeadLetter(TYPE);
            verify(slackAlertService).sendDeadLetterAlert(lastAttempt, "Line extraction timeout");
        }

        @Test
        @DisplayName("Should not alert for a task resolved by someone else")
        void shouldNotAlertWhenAlreadyResolved() {
            doThrow(TaskException.retryable("S3 download timeout")).when(handler).execute(eq(task), any());
            when(taskQueue.retry(task, "S3 download timeout")).thenReturn(RetryOutcome.ALREADY_RESOLVED);

            workerManager.processTask(task);

            verify(metricsConfig, never()).recordRetry(anyString(), anyInt());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should dead-letter a non-retryable failure")
        void shouldDeadLetterFatalFailure() {
            // Given
            doThrow(TaskException.fatal("Document 42 not found")).when(handler).execute(eq(task), any());
            when(taskQueue.fail(task, "Document 42 not found")).thenReturn(true);

            // When
            workerManager.processTask(task);

            // Then
            verify(taskQueue, never()).retry(any(), anyString());
            verify(metricsConfig).recordDeadLetter(TYPE);
            verify(slackAlertService).sendDeadLetterAlert(task, "Document 42 not found");
        }

        @Test
        @DisplayName("Should dead-letter an unclassified error with its message")
        void shouldDeadLetterUnclassifiedError() {
            doThrow(new IllegalArgumentException("Invalid PDF: header missing")).when(handler).execute(eq(task), any());
            when(taskQueue.fail(task, "Invalid PDF: header missing")).thenReturn(true);

            workerManager.processTask(task);

            verify(taskQueue).fail(task, "Invalid PDF: header missing");
            verify(metricsConfig).recordTaskFailure(TYPE, "IllegalArgumentException");
        }

        @Test
        @DisplayName("Should not alert when the dead-letter entry already exists")
        void shouldNotAlertWhenFailIsNoOp() {
            doThrow(TaskException.fatal("Document 42 not found")).when(handler).execute(eq(task), any());
            when(taskQueue.fail(task, "Document 42 not found")).thenReturn(false);

            workerManager.processTask(task);

            verifyNoInteractions(slackAlertService);
            verify(metricsConfig, never()).recordDeadLetter(anyString());
        }

        @Test
        @DisplayName("Should leave a cancelled task pending")
        void shouldLeaveCancelledTaskPending() {
            doThrow(new CancellationException("Worker shutting down")).when(handler).execute(eq(task), any());

            assertThatThrownBy(() -> workerManager.processTask(task))
                    .isInstanceOf(CancellationException.class);

            verify(taskQueue, never()).ack(any());
            verify(taskQueue, never()).retry(any(), anyString());
            verify(taskQueue, never()).fail(any(), anyString());
        }

        @Test
        @DisplayName("Should leave a completed task pending when the ack fails")
        void shouldPropagateAckFailure() {
            // Given
            doThrow(new RedisConnectionFailureException("connection reset")).when(taskQueue).ack(task);

            // When / Then
            assertThatThrownBy(() -> workerManager.processTask(task))
                    .isInstanceOf(RedisConnectionFailureException.class)
                    .hasMessage("connection reset");

            verify(handler).execute(eq(task), any(CancellationToken.class));
            verify(taskQueue, never()).fail(any(), anyString());
            verify(taskQueue, never()).retry(any(), anyString());
            verify(metricsConfig, never()).recordCompleted(anyString());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should not dead-letter a retryable failure when scheduling the retry fails")
        void shouldPropagateRetryFailure() {
            doThrow(TaskException.retryable("S3 download timeout")).when(handler).execute(eq(task), any());
            when(taskQueue.retry(task, "S3 download timeout"))
                    .thenThrow(new RedisConnectionFailureException("connection reset"));

            assertThatThrownBy(() -> workerManager.processTask(task))
                    .isInstanceOf(RedisConnectionFailureException.class);

            verify(taskQueue, never()).fail(any(), anyString());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should run a retried task once it is due")
        void shouldWaitForDelayedTask() {
            var delayed = task.toBuilder().retryCount(1).availableAt(Instant.now().plusMillis(300)).build();

            var started = System.nanoTime();
            workerManager.processTask(delayed);
            var waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(waitedMs).isGreaterThanOrEqualTo(200);
            verify(taskQueue).ack(delayed);
        }
    }

    @Nested
    @DisplayName("Unknown task types")
    class UnknownTypeTests {

        @Test
        @DisplayName("Should dead-letter a task without a handler")
        void shouldDeadLetterUnknownType() {
            // Given
            var unknown = task.toBuilder().type("image:resize").build();
            when(handlerRegistry.getHandler("image:resize")).thenReturn(Optional.empty());
            when(taskQueue.fail(unknown, "Unknown task type: image:resize")).thenReturn(true);

            // When
            workerManager.processTask(unknown);

            // Then
            verify(metricsConfig).recordTaskFailure("image:resize", "unknown_type");
            verify(slackAlertService).sendDeadLetterAlert(unknown, "Unknown task type: image:resize");
            verify(taskQueue, never()).ack(any());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should set up the queue and run until stopped")
        void shouldStartAndStop() throws InterruptedException {
            // Given
            var polled = new CountDownLatch(1);
            when(taskQueue.dequeue(any())).thenAnswer(invocation -> {
                polled.countDown();
                Thread.sleep(20);
                return Optional.empty();
            });

            // When
            workerManager.start();

            // Then
            assertThat(workerManager.getState()).isEqualTo(WorkerState.RUNNING);
            assertThat(workerManager.isRunning()).isTrue();
            assertThat(polled.await(5, TimeUnit.SECONDS)).isTrue();
            verify(taskQueue).setup();

            workerManager.stop();

            assertThat(workerManager.getState()).isEqualTo(WorkerState.STOPPED);
            assertThat(workerManager.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should refuse to start twice")
        void shouldRefuseSecondStart() {
            when(taskQueue.dequeue(any())).thenReturn(Optional.empty());
            workerManager.start();

            assertThatThrownBy(() -> workerManager.start())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("RUNNING");
        }

        @Test
        @DisplayName("Should stay not started when queue setup fails")
        void shouldNotStartWhenSetupFails() {
            doThrow(new IllegalStateException("redis unavailable")).when(taskQueue).setup();

            assertThatThrownBy(() -> workerManager.start())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("redis unavailable");
            assertThat(workerManager.getState()).isEqualTo(WorkerState.NOT_STARTED);
        }

        @Test
        @DisplayName("Should go straight to stopped when never started")
        void shouldStopWithoutStart() {
            workerManager.stop();

            assertThat(workerManager.getState()).isEqualTo(WorkerState.STOPPED);
            assertThatThrownBy(() -> workerManager.start()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should redeliver and acknowledge a task after a failed ack")
        void shouldRetryAckThroughPendingRedelivery() throws InterruptedException {
            // Given
            properties.setErrorBackoffMs(10);
            when(handlerRegistry.getHandler(TYPE)).thenReturn(Optional.of(handler));
            when(taskQueue.dequeue(any())).thenReturn(Optional.of(task), Optional.of(task)).thenAnswer(invocation -> {
                Thread.sleep(20);
                return Optional.empty();
            });
            var acked = new CountDownLatch(1);
            doThrow(new RedisConnectionFailureException("connection reset"))
                    .doAnswer(invocation -> {
                        acked.countDown();
                        return null;
                    })
                    .when(taskQueue).ack(task);

            // When
            workerManager.start();

            // Then
            assertThat(acked.await(5, TimeUnit.SECONDS)).isTrue();
            verify(handler, times(2)).execute(eq(task), any(CancellationToken.class));
            verify(taskQueue, never()).fail(any(), anyString());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should stop within one blocking read and leave its task pending")
        void shouldStopWithinOneBlockingRead() throws InterruptedException {
            // Given
            properties.setBlockMs(300);
            var polled = new CountDownLatch(1);
            when(taskQueue.dequeue(any())).thenAnswer(invocation -> {
                polled.countDown();
                Thread.sleep(300);
                return Optional.of(task);
            });
            workerManager.start();
            assertThat(polled.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            var started = System.nanoTime();
            workerManager.stop();
            var stoppedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            // Then
            assertThat(workerManager.getState()).isEqualTo(WorkerState.STOPPED);
            assertThat(stoppedMs).isLessThan(3000);
            verify(taskQueue, times(1)).dequeue(any());
            verify(handlerRegistry, never()).getHandler(anyString());
            verify(taskQueue, never()).ack(any());
            verify(taskQueue, never()).fail(any(), anyString());
        }

        @Test
        @DisplayName("Should keep polling after a loop error")
        void shouldRecoverFromLoopErrors() throws InterruptedException {
            properties.setErrorBackoffMs(10);
            var secondPoll = new CountDownLatch(2);
            when(taskQueue.dequeue(any())).thenAnswer(invocation -> {
                secondPoll.countDown();
                if (secondPoll.getCount() == 1) {
                    throw new IllegalStateException("connection reset");
                }
                Thread.sleep(20);
                return Optional.empty();
            });

            workerManager.start();

            assertThat(secondPoll.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(workerManager.getState()).isEqualTo(WorkerState.RUNNING);
        }
    }
}
