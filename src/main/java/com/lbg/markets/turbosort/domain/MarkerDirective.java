package com.lbg.markets.turbosort.domain;

import java.util.Optional;

/**
 * Destination subpath declared by a marker file.
 */
public record MarkerDirective(String destination) {

    public MarkerDirective {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be blank");
        }
    }

    /**
     * Parses marker content. The first non-blank line, trimmed, is the destination;
     * content with no such line yields an empty result.
     */
    public static Optional<MarkerDirective> parse(String content) {
        if (content == null) {
            return Optional.empty();
        }
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        return text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .map(MarkerDirective::new);
    }
}
