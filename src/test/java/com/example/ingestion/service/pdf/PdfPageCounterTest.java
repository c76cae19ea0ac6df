package com.example.ingestion.service.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PdfPageCounter Tests")
class PdfPageCounterTest {

    private final PdfPageCounter counter = new PdfPageCounter();

    private static byte[] pdfWithPages(int pages) throws IOException {
        try (var document = new PDDocument(); var out = new ByteArrayOutputStream()) {
            for (var i = 0; i < pages; i++) {
                document.addPage(new PDPage());
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("Should count the pages of a PDF")
    void shouldCountPages() throws IOException {
        assertThat(counter.countPages(pdfWithPages(3))).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject empty input")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> counter.countPages(new byte[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("PDF is empty");
    }

    @Test
    @DisplayName("Should reject bytes that are not a PDF")
    void shouldRejectGarbage() {
        var garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> counter.countPages(garbage))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid PDF: ");
    }
}
