package com.docstream.processing.parser;

import com.docstream.processing.model.ParsedDocument;
import org.springframework.stereotype.Component;

/**
 * Reserved tag for a parser that has not been built. Fails before reading the source.
 */
@Component
public class PlaceholderParser implements DocumentParser {

    @Override
    public ParserType getType() {
        return ParserType.PLACEHOLDER;
    }

    @Override
    public ParsedDocument parse(DocumentSource source) throws ParserNotImplementedException {
        throw new ParserNotImplementedException(ParserType.PLACEHOLDER.tag());
    }
}
