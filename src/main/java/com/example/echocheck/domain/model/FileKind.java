package com.example.echocheck.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of document kinds the ingestion pipeline can turn into text.
 * Each kind owns one canonical extension and selects both the signature check and the extractor.
 */
public enum FileKind {
    TEXT(".txt", "txt"),
    PDF(".pdf", "pdf"),
    DOCX(".docx", "docx");

    private final String extension;
    private final String wireValue;

    FileKind(String extension, String wireValue) {
        this.extension = extension;
        this.wireValue = wireValue;
    }

    /**
     * @return canonical extension including the leading dot
     */
    public String extension() {
        return extension;
    }

    /**
     * @return short lowercase name used in API payloads
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Looks up the kind owning the given extension.
     *
     * @param extension extension with or without the leading dot, any case
     * @return matching kind or empty when the extension is unknown
     */
    public static Optional<FileKind> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith(".")) {
            normalized = "." + normalized;
        }
        for (FileKind kind : values()) {
            if (kind.extension.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
