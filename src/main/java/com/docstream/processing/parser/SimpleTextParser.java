package com.docstream.processing.parser;

import com.docstream.processing.StrategyException;
import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Local text extraction with PDFBox, rendered as one markdown section per page.
 * Also the fallback of {@link GeminiMarkdownParser}.
 */
@Component
public class SimpleTextParser implements DocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(SimpleTextParser.class);

    @Override
    public ParserType getType() {
        return ParserType.SIMPLE;
    }

    @Override
    public ParsedDocument parse(DocumentSource source) throws StrategyException {
        byte[] pdfBytes;
        try {
            pdfBytes = source.readBytes();
        } catch (IOException e) {
            throw new StrategyException("Failed to read source document: " + e.getMessage(), e);
        }
        return new ParsedDocument(ParserType.SIMPLE.tag(), extractPages(pdfBytes));
    }

    List<PageMarkdown> extractPages(byte[] pdfBytes) throws StrategyException {
        List<PageMarkdown> pages = new ArrayList<>();

        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int totalPages = document.getNumberOfPages();

            for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                String content;
                try {
                    content = toMarkdown(stripper.getText(document), pageNum);
                } catch (IOException | RuntimeException e) {
                    logger.warn("Failed to extract text from page {}: {}", pageNum, e.getMessage());
                    content = "# Page " + pageNum + "\n\n*Error extracting text from page " + pageNum
                            + ": " + e.getMessage() + "*\n";
                }
                pages.add(new PageMarkdown(pageNum, content));
            }

            logger.info("PDFBox extracted {} pages", totalPages);
        } catch (IOException e) {
            throw new StrategyException("Simple parsing failed: " + e.getMessage(), e);
        }

        if (pages.isEmpty()) {
            throw new StrategyException("Simple parsing failed: document has no pages");
        }
        return pages;
    }

    /**
     * Renders one page. Markdown control characters in the extracted text are escaped
     * so the page header stays the only heading.
     */
    static String toMarkdown(String text, int pageNumber) {
        if (text == null || text.isBlank()) {
            return "# Page " + pageNumber + "\n\n*No content found on this page*\n";
        }

        String[] lines = text.strip().split("\\R", -1);
        List<String> processed = new ArrayList<>(lines.length);
        for (String line : lines) {
            String trimmed = line.strip();
            processed.add(trimmed.isEmpty() ? "" : escapeMarkdown(trimmed));
        }
        return "# Page " + pageNumber + "\n\n" + String.join("\n", processed) + "\n";
    }

    private static String escapeMarkdown(String line) {
        return line.replace("*", "\\*")
                .replace("_", "\\_")
                .replace("#", "\\#");
    }
}
