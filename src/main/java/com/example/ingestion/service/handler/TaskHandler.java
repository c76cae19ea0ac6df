package com.example.ingestion.service.handler;

import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.service.queue.Task;

/**
 * Interface for task handlers.
 * <p>
 * Each task type has exactly one handler. Implementations should:
 * - Be stateless
 * - Report every failure as a {@link com.example.ingestion.exception.TaskException}
 * - Re-raise {@link java.util.concurrent.CancellationException} untouched
 */
public interface TaskHandler {

    /**
     * Get the task type this handler supports
     */
    TaskType getTaskType();

    /**
     * Execute the task. Returns normally only on success.
     *
     * @param task              The task to execute
     * @param cancellationToken Cancelled when the worker shuts down
     * @throws com.example.ingestion.exception.TaskException on failure
     * @throws java.util.concurrent.CancellationException    when cancelled
     */
    void execute(Task task, CancellationToken cancellationToken);
}
