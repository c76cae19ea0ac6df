package com.example.ingestion.service.queue;

/**
 * Result of {@link TaskQueue#retry(Task, String)}.
 */
public enum RetryOutcome {

    /**
     * A new attempt was appended and the failed delivery acknowledged
     */
    SCHEDULED,

    /**
     * The attempt limit was reached and the task moved to the dead-letter stream
     */
    DEAD_LETTERED,

    /**
     * The delivery was no longer pending, nothing was written
     */
    ALREADY_RESOLVED
}
