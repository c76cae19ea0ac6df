package com.example.ingestion.service.handler;

import com.example.ingestion.exception.TaskException;
import com.example.ingestion.service.queue.Task;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Base class giving every handler the same execution contract.
 * <p>
 * {@link #process(Task, TaskContext)} runs inside one database transaction on a
 * task-execution thread, under an absolute deadline of {@link #getTimeout()}:
 * - success commits
 * - any exception, a timeout or a cancellation rolls back before {@code execute} returns
 * - a body that completes after its token was cancelled is rolled back, never committed
 * - a timeout becomes a retryable {@link TaskException}
 * - a {@link TaskException} keeps the flag its author chose
 * - any other exception becomes a non-retryable {@link TaskException}
 * - a {@link CancellationException} is re-raised unchanged
 * <p>
 * After a failed (not cancelled) execution, {@link #onFailure(Task, TaskException)}
 * runs in a fresh transaction so that failure state survives the rollback.
 */
@Slf4j
public abstract class AbstractTaskHandler implements TaskHandler {

    protected static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    private final TaskExecutionSupport support;

    protected AbstractTaskHandler(TaskExecutionSupport support) {
        this.support = support;
    }

    /**
     * Business logic of the task. Runs inside the task's transaction.
     */
    protected abstract void process(Task task, TaskContext context);

    /**
     * Overall deadline of one execution
     */
    protected Duration getTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Record a failure outside the rolled back transaction. Default does nothing.
     */
    protected void onFailure(Task task, TaskException error) {
    }

    @Override
    public final void execute(Task task, CancellationToken cancellationToken) {
        cancellationToken.throwIfCancellationRequested();

        var timeout = getTimeout();
        var context = new TaskContext(task, cancellationToken, Instant.now().plus(timeout), support.getStepExecutor());
        var finished = new CountDownLatch(1);
        var transaction = support.transaction();

        Future<?> future = support.getTaskExecutor().submit(() -> {
            try {
                transaction.executeWithoutResult(status -> {
                    process(task, context);
                    // a body that ignored the interrupt must not commit after its deadline
                    if (cancellationToken.isCancellationRequested()) {
                        status.setRollbackOnly();
                        throw new CancellationException(cancellationToken.getReason());
                    }
                });
            } finally {
                finished.countDown();
            }
        });

        try {
            cancellationToken.await(future, timeout);
            log.debug("Task {} ({}) committed", task.getId(), task.getType());
        } catch (TimeoutException e) {
            abort(task, cancellationToken, future, finished, "Task timed out");
            var error = TaskException.retryable("Task timed out after " + timeout.toSeconds() + "s");
            log.warn("Task {} ({}) exceeded its {}s deadline and was rolled back", task.getId(), task.getType(), timeout.toSeconds());
            recordFailure(task, error);
            throw error;
        } catch (CancellationException e) {
            abort(task, cancellationToken, future, finished, "Worker shutting down");
            log.info("Task {} ({}) cancelled, transaction rolled back", task.getId(), task.getType());
            throw e;
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof CancellationException cancellation) {
                log.info("Task {} ({}) observed cancellation, transaction rolled back", task.getId(), task.getType());
                throw cancellation;
            }
            var error = classify(task, cause);
            recordFailure(task, error);
            throw error;
        }
    }

    private TaskException classify(Task task, Throwable cause) {
        if (cause instanceof TaskException taskException) {
            log.warn("Task {} ({}) failed (retryable={}): {}", task.getId(), task.getType(),
                    taskException.isRetryable(), taskException.getMessage());
            return taskException;
        }
        log.error("Unexpected error in task {} ({}): {}", task.getId(), task.getType(), cause.getMessage(), cause);
        var message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskException(message, false, cause);
    }

    /**
     * Signal the running body to stop and wait a bounded time for its rollback.
     */
    private void abort(Task task, CancellationToken token, Future<?> future, CountDownLatch finished, String reason) {
        token.cancel(reason);
        future.cancel(true);

        var interrupted = Thread.interrupted();
        try {
            var grace = support.getRollbackGrace();
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Task {} ({}) did not finish rolling back within {}s", task.getId(), task.getType(), grace.toSeconds());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void recordFailure(Task task, TaskException error) {
        try {
            support.newTransaction().executeWithoutResult(status -> onFailure(task, error));
        } catch (RuntimeException e) {
            log.error("Failed to record failure of task {} ({}): {}", task.getId(), task.getType(), e.getMessage(), e);
        }
    }
}
