package com.example.ingestion.exception;

import lombok.Getter;

/**
 * The single error type a task handler surfaces to the worker loop.
 * <p>
 * {@code retryable} tells the loop whether to schedule another attempt
 * or route the task to the dead-letter stream.
 */
@Getter
public class TaskException extends RuntimeException {

    private final boolean retryable;

    public TaskException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TaskException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static TaskException retryable(String message) {
        return new TaskException(message, true);
    }

    public static TaskException fatal(String message) {
        return new TaskException(message, false);
    }
}
