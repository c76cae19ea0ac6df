package com.example.ingestion.service.handler;

import com.example.ingestion.exception.TaskException;
import com.example.ingestion.service.queue.Task;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Per-execution state handed to {@link AbstractTaskHandler#process(Task, TaskContext)}.
 */
@Getter
@RequiredArgsConstructor
public class TaskContext {

    private final Task task;
    private final CancellationToken cancellationToken;
    private final Instant deadline;
    private final ExecutorService stepExecutor;

    /**
     * Run a blocking sub-step under its own deadline.
     * <p>
     * A sub-step that overruns is interrupted and reported as a retryable
     * {@code "<name> timeout"}. Runtime exceptions from the step propagate unchanged.
     */
    public <T> T runStep(String name, Duration timeout, Callable<T> step) {
        cancellationToken.throwIfCancellationRequested();
        var future = stepExecutor.submit(step);
        try {
            return cancellationToken.await(future, timeout);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw TaskException.retryable(name + " timeout");
        } catch (CancellationException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(name + " failed: " + cause.getMessage(), cause);
        }
    }

    public void checkCancelled() {
        cancellationToken.throwIfCancellationRequested();
    }

    /**
     * Cancellable pause between units of work
     */
    public void pause(Duration duration) {
        cancellationToken.sleep(duration);
    }

    public Duration remaining() {
        var remaining = Duration.between(Instant.now(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
