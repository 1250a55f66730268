package com.docstream.processing.parser;

import com.docstream.processing.StrategyException;
import com.docstream.processing.model.ParsedDocument;

/**
 * Turns a source document into ordered per-page markdown.
 */
public interface DocumentParser {

    ParserType getType();

    ParsedDocument parse(DocumentSource source) throws StrategyException;
}
