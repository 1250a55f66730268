package com.docstream.processing;

import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentSummarizerTest {

    @Mock
    private GeminiServiceInterface geminiService;

    @Test
    void summarizesJoinedPages() throws Exception {
        when(geminiService.generateContent(anyString(), eq("summary"))).thenReturn("  ## Summary\n\nShort.  ");
        DocumentSummarizer summarizer = new DocumentSummarizer(geminiService);
        ParsedDocument parsed = new ParsedDocument("simple",
                List.of(new PageMarkdown(1, "# Page 1\n\nalpha"), new PageMarkdown(2, "# Page 2\n\nbeta")));

        String summary = summarizer.summarize(parsed);

        assertThat(summary).isEqualTo("## Summary\n\nShort.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(geminiService).generateContent(prompt.capture(), eq("summary"));
        assertThat(prompt.getValue()).contains("# Page 1\n\nalpha\n\n# Page 2\n\nbeta");
    }

    @Test
    void blankDocumentIsAStrategyErrorWithoutProviderCall() {
        DocumentSummarizer summarizer = new DocumentSummarizer(geminiService);
        ParsedDocument parsed = new ParsedDocument("simple", List.of(new PageMarkdown(1, "  ")));

        assertThatThrownBy(() -> summarizer.summarize(parsed))
                .isInstanceOf(StrategyException.class)
                .hasMessage("No content found in document to summarize");
        verifyNoInteractions(geminiService);
    }

    @Test
    void providerFailureIsAStrategyError() throws Exception {
        when(geminiService.generateContent(anyString(), anyString())).thenThrow(new IOException("HTTP 429 quota exhausted"));
        DocumentSummarizer summarizer = new DocumentSummarizer(geminiService);
        ParsedDocument parsed = new ParsedDocument("simple", List.of(new PageMarkdown(1, "text")));

        assertThatThrownBy(() -> summarizer.summarize(parsed))
                .isInstanceOf(StrategyException.class)
                .hasMessage("Summarization failed: HTTP 429 quota exhausted");
    }

    @Test
    void shortContentIsNotTruncated() {
        assertThat(DocumentSummarizer.prepareContent("abc", 10)).isEqualTo("abc");
    }

    @Test
    void longContentIsCutAtSentenceBoundaryNearTheEnd() {
        String content = "a".repeat(95) + "." + "b".repeat(50);

        String prepared = DocumentSummarizer.prepareContent(content, 100);

        assertThat(prepared).isEqualTo("a".repeat(95) + "." + DocumentSummarizer.TRUNCATION_NOTE);
    }

    @Test
    void longContentWithoutBoundaryIsCutHard() {
        String content = "x".repeat(150);

        String prepared = DocumentSummarizer.prepareContent(content, 100);

        assertThat(prepared).isEqualTo("x".repeat(100) + DocumentSummarizer.TRUNCATION_NOTE);
    }
}
