package com.example.ingestion.exception;

import lombok.Getter;

/**
 * Raised when a task cannot be appended to the queue
 */
@Getter
public class TaskEnqueueException extends RuntimeException {

    private final String taskType;

    public TaskEnqueueException(String taskType, Throwable cause) {
        super(String.format("Failed to enqueue %s task: %s", taskType, cause.getMessage()), cause);
        this.taskType = taskType;
    }
}
