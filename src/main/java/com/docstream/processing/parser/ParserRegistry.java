package com.docstream.processing.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps parser tags to strategies. Resolution is a pure function of the tag.
 */
@Component
public class ParserRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<ParserType, DocumentParser> parsers = new EnumMap<>(ParserType.class);

    public ParserRegistry(List<DocumentParser> strategies) {
        for (DocumentParser strategy : strategies) {
            DocumentParser previous = parsers.put(strategy.getType(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Two strategies registered for parser " + strategy.getType().tag()
                        + ": " + previous.getClass().getSimpleName() + " and " + strategy.getClass().getSimpleName());
            }
        }
        for (ParserType type : ParserType.values()) {
            if (!parsers.containsKey(type)) {
                throw new IllegalStateException("No strategy registered for parser " + type.tag());
            }
        }
        logger.info("Parser registry initialized with parsers: {}", ParserType.supportedTags());
    }

    /**
     * Strategy for the tag, or empty when the tag is not recognized.
     */
    public Optional<DocumentParser> resolve(String tag) {
        return ParserType.fromTag(tag).map(parsers::get);
    }
}
