package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import org.springframework.stereotype.Component;

/**
 * Reduces an untrusted client filename to a safe basename.
 * Directory components from either separator style are dropped, so the result can never
 * traverse outside a target directory.
 */
@Component
public class FilenameSanitizer {

    static final int MAX_FILENAME_LENGTH = 255;
    static final int MAX_STEM_LENGTH = 250;

    /**
     * Sanitizes the filename. Applying this method to its own output returns the same value.
     *
     * @param filename name supplied by the client, possibly with path components
     * @return basename without NUL characters, leading/trailing dots or spaces, at most 255 characters
     * @throws ExtractionException with {@link ExtractionFailure#INVALID_FILENAME} when nothing usable remains
     */
    public String sanitize(String filename) {
        if (filename == null || filename.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.INVALID_FILENAME, "Filename is required.");
        }

        String normalized = filename.replace('\\', '/');
        String basename = normalized.substring(normalized.lastIndexOf('/') + 1);
        String sanitized = stripDotsAndSpaces(basename.replace("\0", ""));

        if (Characters.count(sanitized) > MAX_FILENAME_LENGTH) {
            sanitized = stripDotsAndSpaces(truncate(sanitized));
        }
        if (sanitized.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.INVALID_FILENAME);
        }
        return sanitized;
    }

    /**
     * Shortens an overlong name, keeping its last extension whenever that still fits in 255 characters.
     */
    private String truncate(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Characters.prefix(name, MAX_FILENAME_LENGTH);
        }
        String stem = name.substring(0, dot);
        String extension = name.substring(dot + 1);
        int stemBudget = Math.min(MAX_STEM_LENGTH, MAX_FILENAME_LENGTH - 1 - Characters.count(extension));
        if (stemBudget <= 0) {
            return Characters.prefix(name, MAX_FILENAME_LENGTH);
        }
        return Characters.prefix(stem, stemBudget) + "." + extension;
    }

    private String stripDotsAndSpaces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isDotOrSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isDotOrSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private boolean isDotOrSpace(char c) {
        return c == '.' || c == ' ';
    }
}
