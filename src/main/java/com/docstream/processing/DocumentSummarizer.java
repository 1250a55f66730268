package com.docstream.processing;

import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Produces a document-level markdown summary from parsed pages.
 */
@Service
public class DocumentSummarizer {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSummarizer.class);
    static final int MAX_CONTENT_CHARS = 100_000;
    static final String TRUNCATION_NOTE = "\n\n[NOTE: Document was truncated for summarization due to length]";

    private final GeminiServiceInterface geminiService;

    public DocumentSummarizer(GeminiServiceInterface geminiService) {
        this.geminiService = geminiService;
    }

    public String summarize(ParsedDocument document) throws StrategyException {
        boolean empty = document.getPages().stream()
                .map(PageMarkdown::getContentMd)
                .allMatch(content -> content == null || content.isBlank());
        if (empty) {
            throw new StrategyException("No content found in document to summarize");
        }

        logger.info("Generating summary for document with {} pages", document.getPageCount());
        String content = prepareContent(document.getFullMarkdown(), MAX_CONTENT_CHARS);

        String summary;
        try {
            summary = geminiService.generateContent(buildPrompt(content), "summary");
        } catch (IOException | TimeoutException e) {
            throw new StrategyException("Summarization failed: " + e.getMessage(), e);
        }
        if (summary == null || summary.isBlank()) {
            throw new StrategyException("Summarization failed: provider returned an empty summary");
        }
        return summary.strip();
    }

    /**
     * Truncates to {@code maxChars}, cutting at a sentence end or line break when one falls in the
     * last 10% of the window, and appends a truncation note.
     */
    static String prepareContent(String fullContent, int maxChars) {
        if (fullContent.length() <= maxChars) {
            return fullContent;
        }

        String truncated = fullContent.substring(0, maxChars);
        int lastPeriod = truncated.lastIndexOf('.');
        int lastNewline = truncated.lastIndexOf('\n');
        if (lastPeriod > maxChars * 0.9) {
            truncated = truncated.substring(0, lastPeriod + 1);
        } else if (lastNewline > maxChars * 0.9) {
            truncated = truncated.substring(0, lastNewline);
        }
        truncated += TRUNCATION_NOTE;

        logger.warn("Document truncated from {} to {} characters for summarization",
                fullContent.length(), truncated.length());
        return truncated;
    }

    private String buildPrompt(String content) {
        return "Please provide a comprehensive summary of the following document. Your summary should:\n\n"
                + "1. Start with a brief overview paragraph (2-3 sentences)\n"
                + "2. Include key sections, topics, and main points as bullet points\n"
                + "3. Highlight important entities, numbers, dates, and findings\n"
                + "4. Capture the document's purpose and conclusions\n"
                + "5. Use clear, professional markdown formatting\n"
                + "6. Keep the summary concise but informative (aim for 200-500 words)\n\n"
                + "Document content:\n\n"
                + content
                + "\n\nPlease provide only the summary in markdown format, without any additional commentary.";
    }
}
