package com.example.echocheck.application.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes text before it reaches the classifier, whether it was typed by a user or extracted from a file.
 * The function is total and idempotent.
 */
@Component
public class TextSanitizer {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Strips control characters and normalizes whitespace. Order matters: tabs survive the first
     * step so they can be folded into single spaces by the second.
     *
     * @param text raw text, may be {@code null}
     * @return sanitized text, empty for {@code null} input
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = CONTROL_CHARACTERS.matcher(text).replaceAll("");
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
