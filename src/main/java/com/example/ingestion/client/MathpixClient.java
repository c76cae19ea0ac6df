package com.example.ingestion.client;

import com.example.ingestion.client.ClientModels.ExtractedLines;
import com.example.ingestion.client.ClientModels.PdfStatusResponse;
import com.example.ingestion.client.ClientModels.PdfSubmitRequest;
import com.example.ingestion.client.ClientModels.PdfSubmitResponse;
import com.example.ingestion.config.MathpixProperties;
import com.example.ingestion.exception.LineExtractionException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Client for the Mathpix PDF API.
 * <p>
 * Flow: submit the PDF by URL, poll its status until completed or failed,
 * then fetch the line-by-line result.
 * <p>
 * HTTP 5xx/408/429 and network errors are retryable; other HTTP errors and
 * a processing error reported by Mathpix are not.
 */
@Slf4j
@Component
public class MathpixClient implements LineExtractionClient {

    private static final String SERVICE_NAME = "Mathpix";

    private final WebClient webClient;
    private final MathpixProperties properties;

    public MathpixClient(@Qualifier("mathpixWebClient") WebClient webClient, MathpixProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    @CircuitBreaker(name = "mathpix", fallbackMethod = "extractLinesFallback")
    public ExtractedLines extractLines(String pdfUrl) {
        log.info("Starting Mathpix line extraction");

        var pdfId = submitPdf(pdfUrl);
        awaitCompletion(pdfId);
        var lines = fetchLines(pdfId);

        log.info("Mathpix line extraction complete for pdf {}: {} pages", pdfId,
                lines.getPages() != null ? lines.getPages().size() : 0);
        return lines;
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private ExtractedLines extractLinesFallback(String pdfUrl, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Mathpix: {}", e.getMessage());
        throw new LineExtractionException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    String submitPdf(String pdfUrl) {
        try {
            var response = webClient.post()
                    .uri("/pdf")
                    .headers(this::authenticate)
                    .bodyValue(PdfSubmitRequest.builder().url(pdfUrl).build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(PdfSubmitResponse.class)
                    .timeout(requestTimeout())
                    .block();

            if (response == null || response.getPdfId() == null || response.getPdfId().isBlank()) {
                var reason = response != null && response.getError() != null ? response.getError() : "no pdf_id in response";
                throw new LineExtractionException(SERVICE_NAME, "Failed to submit PDF: " + reason, false);
            }
            log.info("PDF submitted to Mathpix as {}", response.getPdfId());
            return response.getPdfId();
        } catch (LineExtractionException e) {
            throw e;
        } catch (Exception e) {
            throw translate("submit PDF", e);
        }
    }

    PdfStatusResponse fetchStatus(String pdfId) {
        try {
            var status = webClient.get()
                    .uri("/pdf/{pdfId}", pdfId)
                    .headers(this::authenticate)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(PdfStatusResponse.class)
                    .timeout(requestTimeout())
                    .block();

            if (status == null) {
                throw new LineExtractionException(SERVICE_NAME, "Empty status response for pdf " + pdfId, true);
            }
            return status;
        } catch (LineExtractionException e) {
            throw e;
        } catch (Exception e) {
            throw translate("poll status", e);
        }
    }

    ExtractedLines fetchLines(String pdfId) {
        try {
            var lines = webClient.get()
                    .uri("/pdf/{pdfId}.lines.json", pdfId)
                    .headers(this::authenticate)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(ExtractedLines.class)
                    .timeout(requestTimeout())
                    .block();

            if (lines == null) {
                throw new LineExtractionException(SERVICE_NAME, "Empty lines response for pdf " + pdfId, true);
            }
            return lines;
        } catch (LineExtractionException e) {
            throw e;
        } catch (Exception e) {
            throw translate("get lines", e);
        }
    }

    private void awaitCompletion(String pdfId) {
        var maxPolls = properties.getMaxPolls();
        for (var poll = 1; poll <= maxPolls; poll++) {
            var status = fetchStatus(pdfId);

            if (status.isCompleted()) {
                log.info("Mathpix finished pdf {} ({} pages)", pdfId, status.getNumPages());
                return;
            }
            if (status.isFailed()) {
                var error = status.getError() != null ? status.getError() : "Unknown error";
                throw new LineExtractionException(SERVICE_NAME, "Processing error: " + error, false);
            }

            log.info("Pdf {} still processing: status={}, {}% done (poll {}/{})", pdfId, status.getStatus(),
                    status.getPercentDone() != null ? status.getPercentDone() : 0, poll, maxPolls);
            sleepBetweenPolls();
        }
        throw new LineExtractionException(SERVICE_NAME,
                String.format("Timeout waiting for PDF processing (max_polls=%d)", maxPolls), true);
    }

    private void sleepBetweenPolls() {
        try {
            Thread.sleep(properties.getPollIntervalMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for Mathpix");
        }
    }

    private void authenticate(HttpHeaders headers) {
        headers.set("app_id", properties.getAppId());
        headers.set("app_key", properties.getAppKey());
    }

    private Mono<? extends Throwable> toException(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new LineExtractionException(SERVICE_NAME, response.statusCode().value(), body)));
    }

    private RuntimeException translate(String action, Exception e) {
        if (Thread.currentThread().isInterrupted() || hasInterruptedCause(e)) {
            Thread.currentThread().interrupt();
            return new CancellationException("Interrupted during Mathpix " + action);
        }
        log.error("Failed to {} with Mathpix: {}", action, e.getMessage());
        return new LineExtractionException(SERVICE_NAME, "Failed to " + action + ": " + e.getMessage(), e);
    }

    private static boolean hasInterruptedCause(Throwable error) {
        var current = error;
        while (current != null) {
            if (current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(properties.getTimeoutSeconds());
    }
}
