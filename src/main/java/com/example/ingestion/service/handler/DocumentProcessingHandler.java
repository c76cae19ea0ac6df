package com.example.ingestion.service.handler;

import com.example.ingestion.client.ClientModels.ExtractedLines;
import com.example.ingestion.client.ClientModels.PageLines;
import com.example.ingestion.client.LineExtractionClient;
import com.example.ingestion.client.ObjectStorage;
import com.example.ingestion.config.DocumentProcessingProperties;
import com.example.ingestion.domain.entity.Document;
import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.domain.repository.DocumentLineRepository;
import com.example.ingestion.domain.repository.DocumentRepository;
import com.example.ingestion.exception.LineExtractionException;
import com.example.ingestion.exception.TaskException;
import com.example.ingestion.mapper.DocumentLineMapper;
import com.example.ingestion.service.pdf.PdfPageCounter;
import com.example.ingestion.service.progress.Progress;
import com.example.ingestion.service.progress.ProgressTracker;
import com.example.ingestion.service.queue.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Handler for DOCUMENT_PROCESS tasks.
 * <p>
 * Downloads the uploaded PDF, counts its pages, sends it to the line
 * extraction service and stores the extracted lines page by page while
 * publishing progress.
 * <p>
 * Expected payload:
 * - document_id: id of the {@link Document} to process
 */
@Slf4j
@Component
public class DocumentProcessingHandler extends AbstractTaskHandler {

    static final String PAYLOAD_DOCUMENT_ID = "document_id";
    static final int MAX_ERROR_LENGTH = 4000;

    private final DocumentRepository documentRepository;
    private final DocumentLineRepository documentLineRepository;
    private final ObjectStorage objectStorage;
    private final PdfPageCounter pdfPageCounter;
    private final LineExtractionClient lineExtractionClient;
    private final DocumentLineMapper documentLineMapper;
    private final ProgressTracker progressTracker;
    private final DocumentProcessingProperties properties;

    public DocumentProcessingHandler(TaskExecutionSupport support,
                                     DocumentRepository documentRepository,
                                     DocumentLineRepository documentLineRepository,
                                     ObjectStorage objectStorage,
                                     PdfPageCounter pdfPageCounter,
                                     LineExtractionClient lineExtractionClient,
                                     DocumentLineMapper documentLineMapper,
                                     ProgressTracker progressTracker,
                                     DocumentProcessingProperties properties) {
        super(support);
        this.documentRepository = documentRepository;
        this.documentLineRepository = documentLineRepository;
        this.objectStorage = objectStorage;
        this.pdfPageCounter = pdfPageCounter;
        this.lineExtractionClient = lineExtractionClient;
        this.documentLineMapper = documentLineMapper;
        this.progressTracker = progressTracker;
        this.properties = properties;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.DOCUMENT_PROCESS;
    }

    @Override
    protected Duration getTimeout() {
        return Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    @Override
    protected void process(Task task, TaskContext context) {
        var documentId = documentId(task);

        var document = documentRepository.findById(documentId)
                .orElseThrow(() -> TaskException.fatal("Document " + documentId + " not found"));

        // visible to readers of this transaction before any slow work starts
        document.markProcessing();
        documentRepository.saveAndFlush(document);

        var s3Key = document.getS3Key();
        var pdfBytes = context.runStep("S3 download",
                Duration.ofSeconds(properties.getDownloadTimeoutSeconds()),
                () -> objectStorage.download(s3Key));
        var totalPages = context.runStep("PDF parsing",
                Duration.ofSeconds(properties.getParseTimeoutSeconds()),
                () -> pdfPageCounter.countPages(pdfBytes));

        log.info("Processing document {} ({} pages)", documentId, totalPages);

        if (!lineExtractionClient.isConfigured()) {
            throw TaskException.fatal("Line extraction client not configured");
        }

        var pdfUrl = context.runStep("Presigned URL",
                Duration.ofSeconds(properties.getDownloadTimeoutSeconds()),
                () -> objectStorage.publicUrl(s3Key));

        progressTracker.update(Progress.processing(documentId, 0, totalPages, "Extracting lines..."));
        var extracted = extractLines(context, pdfUrl);

        var pages = extracted.getPages() != null ? extracted.getPages() : List.<PageLines>of();
        var removed = documentLineRepository.deleteByDocumentId(documentId);
        if (removed > 0) {
            log.info("Removed {} lines of a previous attempt for document {}", removed, documentId);
        }

        var storedLines = 0;
        var pageDelay = Duration.ofMillis(properties.getPageDelayMs());
        for (var page : pages) {
            context.checkCancelled();

            var lines = documentLineMapper.toLines(documentId, page);
            documentLineRepository.saveAll(lines);
            documentLineRepository.flush();
            storedLines += lines.size();

            var pageNumber = Math.min(page.getPage(), totalPages);
            document.recordProgress(pageNumber, totalPages);
            progressTracker.update(Progress.processing(documentId, pageNumber, totalPages,
                    String.format("Stored page %d of %d", pageNumber, totalPages)));

            if (!pageDelay.isZero()) {
                context.pause(pageDelay);
            }
        }

        document.markReady(totalPages);
        documentRepository.save(document);
        progressTracker.update(Progress.ready(documentId, totalPages));

        log.info("Document {} processed: {} pages, {} lines", documentId, totalPages, storedLines);
    }

    @Override
    protected void onFailure(Task task, TaskException error) {
        var documentId = task.getPayloadLong(PAYLOAD_DOCUMENT_ID).orElse(null);
        if (documentId == null) {
            return;
        }

        var message = truncate(error.getMessage());
        documentRepository.findById(documentId).ifPresent(document -> {
            document.markError(message);
            documentRepository.save(document);
        });

        try {
            progressTracker.update(Progress.error(documentId, message));
        } catch (RuntimeException e) {
            log.warn("Failed to publish error progress for document {}: {}", documentId, e.getMessage());
        }
    }

    private ExtractedLines extractLines(TaskContext context, String pdfUrl) {
        try {
            return context.runStep("Line extraction",
                    Duration.ofSeconds(properties.getExtractionTimeoutSeconds()),
                    () -> lineExtractionClient.extractLines(pdfUrl));
        } catch (LineExtractionException e) {
            throw new TaskException("Line extraction failed: " + e.getMessage(), e.isRetryable(), e);
        }
    }

    private static long documentId(Task task) {
        return task.getPayloadLong(PAYLOAD_DOCUMENT_ID)
                .orElseThrow(() -> TaskException.fatal("Invalid payload: document_id is required"));
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
