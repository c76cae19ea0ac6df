package com.example.ingestion.config;

import com.example.ingestion.service.queue.TaskQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring worker health and throughput.
 * <p>
 * Exposes Prometheus metrics for:
 * - Stream, pending and dead-letter depths
 * - Execution times by task type and outcome
 * - Retries, dead-letters and failures by error type
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    static final String STREAM_LENGTH = "stream_length";
    static final String PENDING = "pending";
    static final String DEAD_LETTERS = "dead_letters";

    private final MeterRegistry meterRegistry;
    private final TaskQueue taskQueue;

    private final ConcurrentHashMap<String, AtomicLong> queueGauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        registerGauge(STREAM_LENGTH, "ingestion_queue_stream_length", "Number of entries in the task stream");
        registerGauge(PENDING, "ingestion_queue_pending", "Delivered but unacknowledged entries of the consumer group");
        registerGauge(DEAD_LETTERS, "ingestion_queue_dead_letters", "Number of entries in the dead-letter stream");
    }

    private void registerGauge(String key, String name, String description) {
        queueGauges.put(key, new AtomicLong(0));
        Gauge.builder(name, queueGauges.get(key), AtomicLong::get)
                .description(description)
                .register(meterRegistry);
    }

    /**
     * Periodically refresh queue gauges from Redis
     */
    @Scheduled(fixedDelayString = "${worker.metrics-update-interval-ms:30000}")
    public void updateMetrics() {
        try {
            var stats = taskQueue.stats();
            queueGauges.get(STREAM_LENGTH).set(stats.getStreamLength());
            queueGauges.get(PENDING).set(stats.getPendingCount());
            queueGauges.get(DEAD_LETTERS).set(stats.getDeadLetterCount());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh queue metrics: {}", e.getMessage());
        }
    }

    public Timer.Sample startTaskExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record task execution time
     *
     * @param outcome one of completed, retried, dead_lettered, cancelled
     */
    public void recordTaskExecution(Timer.Sample sample, String taskType, String outcome) {
        sample.stop(Timer.builder("ingestion_task_execution_time")
                .tag("type", tagValue(taskType))
                .tag("outcome", outcome)
                .description("Task execution time")
                .register(meterRegistry));
    }

    public void recordCompleted(String taskType) {
        meterRegistry.counter("ingestion_tasks_completed", "type", tagValue(taskType)).increment();
    }

    public void recordRetry(String taskType, int attemptNumber) {
        meterRegistry.counter("ingestion_task_retries",
                "type", tagValue(taskType),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordDeadLetter(String taskType) {
        meterRegistry.counter("ingestion_tasks_dead_lettered", "type", tagValue(taskType)).increment();
    }

    public void recordTaskFailure(String taskType, String errorType) {
        meterRegistry.counter("ingestion_task_failures",
                "type", tagValue(taskType),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    private static String tagValue(String taskType) {
        return taskType == null || taskType.isBlank() ? "unknown" : taskType;
    }
}
