package com.docstream.processing.parser;

import com.docstream.TestPdfFactory;
import com.docstream.processing.GeminiServiceInterface;
import com.docstream.processing.StrategyException;
import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeminiMarkdownParserTest {

    @Mock
    private GeminiServiceInterface geminiService;

    @Test
    void splitsResponseOnPageMarkers() throws Exception {
        when(geminiService.isAvailable()).thenReturn(true);
        when(geminiService.generateContent(anyString(), any(byte[].class), eq("parse")))
                .thenReturn("# Page 1\nIntro\n\n# Page 2\n| a | b |\n|---|---|\n");
        GeminiMarkdownParser parser = new GeminiMarkdownParser(geminiService, new SimpleTextParser());

        ParsedDocument parsed = parser.parse(DocumentSource.ofBytes(TestPdfFactory.minimalPdfBytes("x")));

        assertThat(parsed.getParser()).isEqualTo("gemini");
        assertThat(parsed.getPages()).extracting(PageMarkdown::getContentMd)
                .containsExactly("# Page 1\n\nIntro", "# Page 2\n\n| a | b |\n|---|---|");
    }

    @Test
    void responseWithoutMarkersIsOnePage() {
        List<PageMarkdown> pages = GeminiMarkdownParser.splitByPageMarkers("  just some text\n");

        assertThat(pages).containsExactly(new PageMarkdown(1, "just some text"));
    }

    @Test
    void pagesAreNumberedInResponseOrder() {
        List<PageMarkdown> pages = GeminiMarkdownParser.splitByPageMarkers("preamble\n# Page 3\nc\n# Page 7\nd");

        assertThat(pages).extracting(PageMarkdown::getPageNumber).containsExactly(1, 2);
        assertThat(pages.get(0).getContentMd()).isEqualTo("# Page 3\n\nc");
    }

    @Test
    void fallsBackToSimpleParserWhenNotConfigured() throws Exception {
        when(geminiService.isAvailable()).thenReturn(false);
        GeminiMarkdownParser parser = new GeminiMarkdownParser(geminiService, new SimpleTextParser());

        ParsedDocument parsed = parser.parse(DocumentSource.ofBytes(TestPdfFactory.pdfWithPages("one", "two")));

        assertThat(parsed.getPageCount()).isEqualTo(2);
        assertThat(parsed.getPages().get(1).getContentMd()).contains("two");
        verify(geminiService, never()).generateContent(anyString(), any(byte[].class), anyString());
    }

    @Test
    void fallsBackToSimpleParserWhenGeminiFails() throws Exception {
        when(geminiService.isAvailable()).thenReturn(true);
        when(geminiService.generateContent(anyString(), any(byte[].class), anyString()))
                .thenThrow(new TimeoutException("Gemini API call timed out after 120s"));
        GeminiMarkdownParser parser = new GeminiMarkdownParser(geminiService, new SimpleTextParser());

        ParsedDocument parsed = parser.parse(DocumentSource.ofBytes(TestPdfFactory.minimalPdfBytes("fallback text")));

        assertThat(parsed.getPageCount()).isEqualTo(1);
        assertThat(parsed.getPages().get(0).getContentMd()).contains("fallback text");
    }

    @Test
    void failsWhenGeminiAndFallbackBothFail() throws Exception {
        when(geminiService.isAvailable()).thenReturn(true);
        when(geminiService.generateContent(anyString(), any(byte[].class), anyString()))
                .thenThrow(new IOException("HTTP 400 Bad Request"));
        GeminiMarkdownParser parser = new GeminiMarkdownParser(geminiService, new SimpleTextParser());
        byte[] broken = "definitely not a pdf document".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> parser.parse(DocumentSource.ofBytes(broken)))
                .isInstanceOf(StrategyException.class)
                .hasMessageStartingWith("Both Gemini and simple parsing failed")
                .hasMessageContaining("HTTP 400 Bad Request")
                .hasMessageContaining("Simple parsing failed");
    }
}
