package com.example.ingestion.service.worker;

import com.example.ingestion.config.MetricsConfig;
import com.example.ingestion.config.WorkerProperties;
import com.example.ingestion.domain.enums.WorkerState;
import com.example.ingestion.exception.TaskException;
import com.example.ingestion.service.alert.SlackAlertService;
import com.example.ingestion.service.handler.CancellationToken;
import com.example.ingestion.service.handler.TaskHandler;
import com.example.ingestion.service.handler.TaskHandlerRegistry;
import com.example.ingestion.service.queue.RetryOutcome;
import com.example.ingestion.service.queue.Task;
import com.example.ingestion.service.queue.TaskQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the worker run loop.
 * <p>
 * Flow per iteration:
 * 1. Dequeue with a bounded wait (own pending entries first)
 * 2. Resolve the handler by type; unknown types are dead-lettered
 * 3. Wait until a retried task is due
 * 4. Execute and map the outcome: success acks, a retryable error retries,
 * anything else dead-letters
 * <p>
 * Cancellation is not an outcome: a task interrupted by {@link #stop()} stays
 * pending for this consumer (or for the orphan reclaim of another one).
 * <p>
 * The blocking read is a server-side {@code XREADGROUP BLOCK} that the client
 * cannot abort, so {@link #stop()} returns within one {@code worker.block-ms}
 * read plus the in-flight task's rollback. An entry returned by that last read
 * is not executed; it stays pending.
 * <p>
 * A retried task that is not due yet holds the loop until its
 * {@code available_at}; entries behind it wait for that delay.
 */
@Slf4j
@Service
public class WorkerManager implements SmartLifecycle {

    private final TaskQueue taskQueue;
    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final WorkerProperties properties;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.NOT_STARTED);
    private volatile boolean running;
    private final CancellationToken rootToken = CancellationToken.create();
    private ExecutorService loopExecutor;

    public WorkerManager(TaskQueue taskQueue, TaskHandlerRegistry handlerRegistry, SlackAlertService slackAlertService,
                         MetricsConfig metricsConfig, WorkerProperties properties) {
        this.taskQueue = taskQueue;
        this.handlerRegistry = handlerRegistry;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
    }

    /**
     * Prepare the consumer group and launch the run loop.
     *
     * @throws IllegalStateException if the worker is running or was already stopped
     */
    @Override
    public void start() {
        var current = state.get();
        if (current != WorkerState.NOT_STARTED) {
            throw new IllegalStateException("Worker cannot be started in state " + current);
        }

        taskQueue.setup();

        if (!state.compareAndSet(WorkerState.NOT_STARTED, WorkerState.RUNNING)) {
            throw new IllegalStateException("Worker cannot be started in state " + state.get());
        }
        running = true;
        loopExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("worker-loop-"));
        loopExecutor.submit(this::runLoop);

        log.info("Worker {} started, handling {}", taskQueue.getConsumerName(), handlerRegistry.getRegisteredTypes());
    }

    /**
     * Cancel the run loop and wait for it to finish. The task in flight is
     * rolled back and left pending.
     */
    @Override
    public void stop() {
        if (state.compareAndSet(WorkerState.NOT_STARTED, WorkerState.STOPPED)) {
            return;
        }
        if (!state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING)) {
            log.debug("Worker already {}", state.get());
            return;
        }

        log.info("Stopping worker {}", taskQueue.getConsumerName());
        running = false;
        rootToken.cancel("Worker shutting down");
        loopExecutor.shutdown();

        var timeout = properties.getShutdownTimeoutSeconds();
        try {
            if (!loopExecutor.awaitTermination(timeout, TimeUnit.SECONDS)) {
                log.warn("Worker loop did not finish within {}s, interrupting it", timeout);
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loopExecutor.shutdownNow();
        } finally {
            state.set(WorkerState.STOPPED);
        }
        log.info("Worker {} stopped", taskQueue.getConsumerName());
    }

    @Override
    public boolean isRunning() {
        return state.get() == WorkerState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isEnabled();
    }

    public WorkerState getState() {
        return state.get();
    }

    public String getConsumerName() {
        return taskQueue.getConsumerName();
    }

    void runLoop() {
        var block = Duration.ofMillis(properties.getBlockMs());

        while (running) {
            try {
                var next = taskQueue.dequeue(block);
                if (next.isEmpty()) {
                    continue;
                }
                if (!running) {
                    log.debug("Worker stopping, task {} left pending", next.get().getId());
                    break;
                }
                processTask(next.get());
            } catch (CancellationException e) {
                if (!running) {
                    log.debug("Worker loop cancelled: {}", e.getMessage());
                    break;
                }
                log.warn("Task cancelled while the worker is running: {}", e.getMessage());
                backoff();
            } catch (Exception e) {
                log.error("Error in worker loop: {}", e.getMessage(), e);
                backoff();
            }
        }
    }

    /**
     * Run one task and turn its outcome into exactly one queue operation.
     * Queue errors and cancellation propagate to the loop.
     */
    void processTask(Task task) {
        var handler = handlerRegistry.getHandler(task.getType()).orElse(null);
        if (handler == null) {
            var error = "Unknown task type: " + task.getType();
            log.error("{} (task {}, entry {})", error, task.getId(), task.getDeliveryToken());
            metricsConfig.recordTaskFailure(task.getType(), "unknown_type");
            deadLetter(task, error);
            return;
        }

        waitUntilAvailable(task);
        execute(handler, task);
    }

    private void execute(TaskHandler handler, Task task) {
        var taskToken = rootToken.newChild();
        var sample = metricsConfig.startTaskExecutionTimer();
        log.info("Processing task {} (type: {}, attempt: {})", task.getId(), task.getType(), task.getRetryCount() + 1);

        TaskException failure = null;
        try {
            handler.execute(task, taskToken);
        } catch (TaskException e) {
            metricsConfig.recordTaskFailure(task.getType(), e.isRetryable() ? "retryable" : "fatal");
            failure = e;
        } catch (CancellationException e) {
            metricsConfig.recordTaskExecution(sample, task.getType(), "cancelled");
            log.info("Task {} cancelled, left pending", task.getId());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unclassified error in task {} ({}): {}", task.getId(), task.getType(), e.getMessage(), e);
            metricsConfig.recordTaskFailure(task.getType(), e.getClass().getSimpleName());
            failure = new TaskException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false, e);
        } finally {
            taskToken.release();
        }

        // queue errors below reach the loop and leave the entry pending
        if (failure == null) {
            taskQueue.ack(task);
            metricsConfig.recordTaskExecution(sample, task.getType(), "completed");
            metricsConfig.recordCompleted(task.getType());
            log.info("Task {} completed", task.getId());
        } else if (failure.isRetryable()) {
            var outcome = retry(task, failure.getMessage());
            metricsConfig.recordTaskExecution(sample, task.getType(),
                    outcome == RetryOutcome.SCHEDULED ? "retried" : "dead_lettered");
        } else {
            deadLetter(task, failure.getMessage());
            metricsConfig.recordTaskExecution(sample, task.getType(), "dead_lettered");
        }
    }

    private RetryOutcome retry(Task task, String error) {
        var outcome = taskQueue.retry(task, error);
        if (outcome == RetryOutcome.SCHEDULED) {
            metricsConfig.recordRetry(task.getType(), task.getRetryCount() + 1);
        } else if (outcome == RetryOutcome.DEAD_LETTERED) {
            metricsConfig.recordDeadLetter(task.getType());
            slackAlertService.sendDeadLetterAlert(task, error);
        } else {
            log.debug("Task {} was already resolved, no retry scheduled", task.getId());
        }
        return outcome;
    }

    private void deadLetter(Task task, String error) {
        if (taskQueue.fail(task, error)) {
            metricsConfig.recordDeadLetter(task.getType());
            slackAlertService.sendDeadLetterAlert(task, error);
        }
    }

    /**
     * Retried tasks carry the earliest time they may run.
     */
    private void waitUntilAvailable(Task task) {
        var now = Instant.now();
        if (!task.isDelayed(now)) {
            return;
        }
        var wait = Duration.between(now, task.getAvailableAt());
        log.info("Task {} is not due yet, waiting {}ms", task.getId(), wait.toMillis());
        rootToken.sleep(wait);
    }

    private void backoff() {
        try {
            rootToken.sleep(Duration.ofMillis(properties.getErrorBackoffMs()));
        } catch (CancellationException e) {
            log.debug("Backoff ended by shutdown");
        }
    }
}
