package com.example.ingestion.service;

import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.dto.DeadLetterResponse;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.mapper.WorkerMapper;
import com.example.ingestion.service.handler.TaskHandlerRegistry;
import com.example.ingestion.service.queue.TaskQueue;
import com.example.ingestion.service.worker.WorkerManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only view of the worker and its queue for operators.
 */
@Service
@RequiredArgsConstructor
public class WorkerStatusService {

    private final WorkerManager workerManager;
    private final TaskQueue taskQueue;
    private final TaskHandlerRegistry handlerRegistry;
    private final WorkerMapper workerMapper;

    public WorkerStatusResponse getStatus() {
        var response = workerMapper.toStatusResponse(taskQueue.stats());
        response.setState(workerManager.getState());
        response.setRegisteredTaskTypes(handlerRegistry.getRegisteredTypes().stream()
                .map(TaskType::getCode)
                .collect(Collectors.toCollection(TreeSet::new)));
        return response;
    }

    /**
     * Newest dead-letter entries first
     */
    public List<DeadLetterResponse> getDeadLetters(int limit) {
        return workerMapper.toResponses(taskQueue.deadLetters(limit));
    }
}
