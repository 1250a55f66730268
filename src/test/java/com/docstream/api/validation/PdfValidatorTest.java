package com.docstream.api.validation;

import com.docstream.TestPdfFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PdfValidator.
 */
class PdfValidatorTest {

    private PdfValidator pdfValidator;

    @BeforeEach
    void setUp() {
        pdfValidator = new PdfValidator(1); // 1 MB
    }

    @Test
    void testValidPdfPasses() throws IOException {
        byte[] pdf = TestPdfFactory.minimalPdfBytes("hello");

        assertThatCode(() -> pdfValidator.validate("report.PDF", pdf)).doesNotThrowAnyException();
    }

    @Test
    void testMissingFilename() {
        assertThatThrownBy(() -> pdfValidator.validate(" ", "%PDF-1.4 body".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("No filename provided");
    }

    @Test
    void testWrongExtension() {
        assertThatThrownBy(() -> pdfValidator.validate("notes.txt", "%PDF-1.4 body".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("Only PDF files are supported");
    }

    @Test
    void testEmptyFile() {
        assertThatThrownBy(() -> pdfValidator.validate("empty.pdf", new byte[0]))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("Empty file");
    }

    @Test
    void testTooSmall() {
        assertThatThrownBy(() -> pdfValidator.validate("tiny.pdf", "%PDF-1".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("too small");
    }

    @Test
    void testTooLarge() {
        byte[] big = new byte[(int) pdfValidator.getMaxUploadBytes() + 1];
        System.arraycopy("%PDF-".getBytes(StandardCharsets.US_ASCII), 0, big, 0, 5);

        assertThatThrownBy(() -> pdfValidator.validate("big.pdf", big))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("exceeds maximum of 1MB");
    }

    @Test
    void testMissingMagicBytes() {
        assertThatThrownBy(() -> pdfValidator.validate("fake.pdf", "NOT A PDF FILE AT ALL".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("does not appear to be a valid PDF");
    }

    @Test
    void testHasPdfHeader() {
        assertThat(PdfValidator.hasPdfHeader("%PDF-1.7".getBytes(StandardCharsets.US_ASCII))).isTrue();
        assertThat(PdfValidator.hasPdfHeader("%PD".getBytes(StandardCharsets.US_ASCII))).isFalse();
    }
}
