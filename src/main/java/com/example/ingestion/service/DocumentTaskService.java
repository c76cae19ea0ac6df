package com.example.ingestion.service;

import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.domain.repository.DocumentRepository;
import com.example.ingestion.exception.DocumentNotFoundException;
import com.example.ingestion.exception.TaskEnqueueException;
import com.example.ingestion.service.progress.ProgressTracker;
import com.example.ingestion.service.queue.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Producer side of the document processing queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentTaskService {

    private final DocumentRepository documentRepository;
    private final TaskQueue taskQueue;
    private final ProgressTracker progressTracker;

    /**
     * Queue a document for line extraction.
     *
     * @return id of the enqueued task
     * @throws DocumentNotFoundException if the document does not exist
     * @throws TaskEnqueueException      if the queue cannot be reached
     */
    @Transactional(readOnly = true)
    public String enqueueProcessing(long documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }

        // a snapshot left by an earlier run would otherwise be served until the new run reports
        progressTracker.clear(documentId);

        try {
            var taskId = taskQueue.enqueue(TaskType.DOCUMENT_PROCESS, Map.of("document_id", documentId));
            log.info("Queued document {} for processing as task {}", documentId, taskId);
            return taskId;
        } catch (DataAccessException e) {
            throw new TaskEnqueueException(TaskType.DOCUMENT_PROCESS.getCode(), e);
        }
    }
}
