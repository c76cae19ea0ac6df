package com.example.ingestion.client;

import com.example.ingestion.client.ClientModels.ExtractedLines;

/**
 * OCR service turning a PDF into structured lines.
 */
public interface LineExtractionClient {

    /**
     * Whether credentials for the service are present
     */
    boolean isConfigured();

    /**
     * Extract all lines of the PDF reachable at {@code pdfUrl}. Blocks until the service is done.
     *
     * @throws com.example.ingestion.exception.LineExtractionException carrying its own retryable flag
     * @throws java.util.concurrent.CancellationException                 when the calling thread is interrupted
     */
    ExtractedLines extractLines(String pdfUrl);
}
