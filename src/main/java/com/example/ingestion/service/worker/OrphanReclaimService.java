package com.example.ingestion.service.worker;

import com.example.ingestion.config.WorkerProperties;
import com.example.ingestion.service.queue.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Reclaims entries left pending by consumers that died.
 * <p>
 * A crashed worker's pending entries are never redelivered to anyone else by
 * Redis itself. This job claims entries idle longer than the configured
 * threshold for the local consumer; the local run loop then picks them up
 * through its pending-first read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrphanReclaimService {

    private final TaskQueue taskQueue;
    private final WorkerManager workerManager;
    private final WorkerProperties properties;

    @Scheduled(fixedDelayString = "${worker.orphan-reclaim-interval-ms:60000}")
    @SchedulerLock(name = "orphanReclaimJob", lockAtLeastFor = "10s", lockAtMostFor = "5m")
    public void reclaimOrphanedTasks() {
        if (!workerManager.isRunning()) {
            log.debug("Worker not running, skipping orphan reclaim");
            return;
        }

        try {
            var claimed = taskQueue.claimOrphaned(Duration.ofMillis(properties.getOrphanMinIdleMs()),
                    properties.getOrphanClaimBatchSize());
            if (claimed > 0) {
                log.warn("Reclaimed {} orphaned tasks for consumer {}", claimed, taskQueue.getConsumerName());
            } else {
                log.debug("No orphaned tasks found");
            }
        } catch (DataAccessException e) {
            log.error("Error reclaiming orphaned tasks: {}", e.getMessage(), e);
        }
    }
}
