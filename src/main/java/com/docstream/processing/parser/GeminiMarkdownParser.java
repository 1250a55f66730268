package com.docstream.processing.parser;

import com.docstream.processing.GeminiServiceInterface;
import com.docstream.processing.StrategyException;
import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown extraction delegated to Gemini. The PDF is sent inline and the model is asked to mark
 * every page with a "# Page N" header. Falls back to {@link SimpleTextParser} when Gemini is not
 * configured or the call fails.
 */
@Component
public class GeminiMarkdownParser implements DocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(GeminiMarkdownParser.class);
    private static final Pattern PAGE_MARKER = Pattern.compile("^# Page\\s+(\\d+)\\s*$", Pattern.MULTILINE);

    static final String PROMPT = """
            You are a PDF-to-Markdown parser. Extract the content from this PDF and convert it to markdown format.

            IMPORTANT INSTRUCTIONS:
            1. Process each page separately and clearly mark page boundaries
            2. Use the exact format: "# Page N" (where N is the page number) as a header for each page
            3. Preserve the document structure using appropriate markdown formatting
            4. Convert tables to markdown table format when possible
            5. Preserve headings, lists, and other formatting elements
            6. If a page has no readable content, indicate this clearly
            7. Do not add any commentary or explanations - just return the formatted content

            Please process this PDF and return the markdown content with clear page separations.""";

    private final GeminiServiceInterface geminiService;
    private final SimpleTextParser simpleTextParser;

    public GeminiMarkdownParser(GeminiServiceInterface geminiService, SimpleTextParser simpleTextParser) {
        this.geminiService = geminiService;
        this.simpleTextParser = simpleTextParser;
    }

    @Override
    public ParserType getType() {
        return ParserType.GEMINI;
    }

    @Override
    public ParsedDocument parse(DocumentSource source) throws StrategyException {
        byte[] pdfBytes;
        try {
            pdfBytes = source.readBytes();
        } catch (IOException e) {
            throw new StrategyException("Failed to read source document: " + e.getMessage(), e);
        }

        if (!geminiService.isAvailable()) {
            logger.warn("Gemini API not available, falling back to simple parser");
            return new ParsedDocument(ParserType.GEMINI.tag(), simpleTextParser.extractPages(pdfBytes));
        }

        try {
            String markdown = geminiService.generateContent(PROMPT, pdfBytes, "parse");
            List<PageMarkdown> pages = splitByPageMarkers(markdown);
            logger.info("Parsed {} pages with Gemini", pages.size());
            return new ParsedDocument(ParserType.GEMINI.tag(), pages);
        } catch (IOException | TimeoutException e) {
            String geminiError = "Gemini parsing failed: " + e.getMessage();
            logger.warn("{}; falling back to simple parser", geminiError);
            try {
                return new ParsedDocument(ParserType.GEMINI.tag(), simpleTextParser.extractPages(pdfBytes));
            } catch (StrategyException fallbackError) {
                throw new StrategyException("Both Gemini and simple parsing failed. Gemini: " + geminiError
                        + ", simple: " + fallbackError.getMessage(), fallbackError);
            }
        }
    }

    /**
     * Splits a response on "# Page N" header lines. Text before the first marker is dropped.
     * A response without markers becomes a single page.
     */
    static List<PageMarkdown> splitByPageMarkers(String markdown) {
        List<PageMarkdown> pages = new ArrayList<>();
        Matcher matcher = PAGE_MARKER.matcher(markdown);

        String currentHeader = null;
        int contentStart = 0;
        while (matcher.find()) {
            if (currentHeader != null) {
                addPage(pages, currentHeader, markdown.substring(contentStart, matcher.start()));
            }
            currentHeader = matcher.group(1);
            contentStart = matcher.end();
        }
        if (currentHeader != null) {
            addPage(pages, currentHeader, markdown.substring(contentStart));
        }

        if (pages.isEmpty()) {
            logger.warn("No page markers found in Gemini response, treating as single page");
            pages.add(new PageMarkdown(1, markdown.strip()));
        }
        return pages;
    }

    private static void addPage(List<PageMarkdown> pages, String pageHeader, String content) {
        pages.add(new PageMarkdown(pages.size() + 1, "# Page " + pageHeader + "\n\n" + content.strip()));
    }
}
