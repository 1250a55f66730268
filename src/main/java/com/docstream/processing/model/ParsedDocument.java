package com.docstream.processing.model;

import com.docstream.shared.model.PageMarkdown;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of a parsing strategy: per-page markdown in document page order.
 */
public class ParsedDocument {

    private final String parser;
    private final List<PageMarkdown> pages;

    public ParsedDocument(String parser, List<PageMarkdown> pages) {
        this.parser = parser;
        this.pages = List.copyOf(pages);
    }

    public String getParser() {
        return parser;
    }

    public List<PageMarkdown> getPages() {
        return pages;
    }

    public int getPageCount() {
        return pages.size();
    }

    /**
     * All pages joined with a blank line between them.
     */
    public String getFullMarkdown() {
        return pages.stream()
                .map(PageMarkdown::getContentMd)
                .collect(Collectors.joining("\n\n"));
    }
}
