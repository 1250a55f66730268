package com.docstream.processing.parser;

import com.docstream.processing.StrategyException;

public class ParserNotImplementedException extends StrategyException {

    public ParserNotImplementedException(String parserTag) {
        super("Parser '" + parserTag + "' is not implemented. Use 'simple' or 'gemini' instead.");
    }
}
