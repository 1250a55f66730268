package com.docstream.processing.parser;

import com.docstream.TestPdfFactory;
import com.docstream.processing.StrategyException;
import com.docstream.processing.model.ParsedDocument;
import com.docstream.shared.model.PageMarkdown;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleTextParserTest {

    private final SimpleTextParser parser = new SimpleTextParser();

    @Test
    void extractsOnePageOfMarkdownPerPdfPage() throws Exception {
        byte[] pdf = TestPdfFactory.pdfWithPages("First page text", "Second page text", "Third page text");

        ParsedDocument parsed = parser.parse(DocumentSource.ofBytes(pdf));

        assertThat(parsed.getParser()).isEqualTo("simple");
        assertThat(parsed.getPageCount()).isEqualTo(3);
        assertThat(parsed.getPages()).extracting(PageMarkdown::getPageNumber).containsExactly(1, 2, 3);
        assertThat(parsed.getPages().get(0).getContentMd()).startsWith("# Page 1\n\n").contains("First page text");
        assertThat(parsed.getPages().get(2).getContentMd()).startsWith("# Page 3\n\n").contains("Third page text");
    }

    @Test
    void blankPageGetsPlaceholderText() throws Exception {
        byte[] pdf = TestPdfFactory.pdfWithPages("Has text", "");

        ParsedDocument parsed = parser.parse(DocumentSource.ofBytes(pdf));

        assertThat(parsed.getPages().get(1).getContentMd())
                .isEqualTo("# Page 2\n\n*No content found on this page*\n");
    }

    @Test
    void unreadableDocumentIsAStrategyError() {
        byte[] garbage = "this is not a pdf document at all".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> parser.parse(DocumentSource.ofBytes(garbage)))
                .isInstanceOf(StrategyException.class)
                .hasMessageStartingWith("Simple parsing failed");
    }

    @Test
    void sourceReadFailureIsAStrategyError() {
        DocumentSource broken = () -> {
            throw new IOException("storage offline");
        };

        assertThatThrownBy(() -> parser.parse(broken))
                .isInstanceOf(StrategyException.class)
                .hasMessageContaining("storage offline");
    }

    @Test
    void toMarkdownEscapesControlCharactersAndTrimsLines() {
        String markdown = SimpleTextParser.toMarkdown("  Total *net* #1  \n\nsnake_case\n", 4);

        assertThat(markdown).isEqualTo("# Page 4\n\nTotal \\*net\\* \\#1\n\nsnake\\_case\n");
    }

    @Test
    void toMarkdownTreatsWhitespaceAsEmpty() {
        assertThat(SimpleTextParser.toMarkdown(" \n\t", 1)).isEqualTo("# Page 1\n\n*No content found on this page*\n");
        assertThat(SimpleTextParser.toMarkdown(null, 2)).isEqualTo("# Page 2\n\n*No content found on this page*\n");
    }
}
