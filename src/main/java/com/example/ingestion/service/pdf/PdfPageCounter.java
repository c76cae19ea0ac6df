package com.example.ingestion.service.pdf;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads the page count of a PDF with Apache PDFBox.
 */
@Slf4j
@Component
public class PdfPageCounter {

    /**
     * @throws IllegalArgumentException if the bytes are not a readable PDF
     */
    public int countPages(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new IllegalArgumentException("PDF is empty");
        }
        try (var document = Loader.loadPDF(pdfBytes)) {
            var pages = document.getNumberOfPages();
            log.debug("Parsed PDF of {} bytes: {} pages", pdfBytes.length, pages);
            return pages;
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid PDF: " + e.getMessage(), e);
        }
    }
}
