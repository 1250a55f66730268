package com.docstream.processing.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of parser tags. Legacy names are accepted as aliases of their canonical tag.
 */
public enum ParserType {
    SIMPLE("simple", "pypdf"),
    GEMINI("gemini"),
    PLACEHOLDER("placeholder", "mistral");

    private final String tag;
    private final List<String> aliases;

    ParserType(String tag, String... aliases) {
        this.tag = tag;
        this.aliases = List.of(aliases);
    }

    public String tag() {
        return tag;
    }

    public static Optional<ParserType> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(normalized) || type.aliases.contains(normalized))
                .findFirst();
    }

    public static String supportedTags() {
        return Arrays.stream(values()).map(ParserType::tag).collect(Collectors.joining(", "));
    }
}
