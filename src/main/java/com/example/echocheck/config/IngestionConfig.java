package com.example.echocheck.config;

import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.domain.model.FileKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the bound {@link IngestionProperties} into the immutable {@link ExtractionLimits}
 * shared by the ingestion components.
 */
@Configuration
public class IngestionConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    /**
     * Validates the configured extensions and snapshots every limit.
     *
     * @param properties bound ingestion settings
     * @return limits used for the lifetime of the process
     * @throws IllegalStateException when an allowed extension has no extractor
     */
    @Bean
    public ExtractionLimits extractionLimits(IngestionProperties properties) {
        Set<String> extensions = new LinkedHashSet<>();
        for (String raw : properties.getAllowedExtensions()) {
            String extension = normalizeExtension(raw);
            if (FileKind.fromExtension(extension).isEmpty()) {
                throw new IllegalStateException("Allowed extension '" + raw + "' has no matching file kind.");
            }
            extensions.add(extension);
        }

        ExtractionLimits limits = new ExtractionLimits(
                extensions,
                properties.getMaxUploadSize().toBytes(),
                properties.getMaxPdfPages(),
                properties.getMaxDocxParagraphs(),
                properties.getMaxDecompressedSize().toBytes(),
                properties.getMinTextLength(),
                properties.getMaxTextLength()
        );
        log.info("Ingestion limits: extensions={}, maxUploadBytes={}, maxPdfPages={}, maxDocxParagraphs={}, "
                        + "maxDecompressedBytes={}, textLength=[{}, {}]",
                limits.allowedExtensions(), limits.maxUploadBytes(), limits.maxPdfPages(),
                limits.maxDocxParagraphs(), limits.maxDecompressedBytes(),
                limits.minTextLength(), limits.maxTextLength());
        return limits;
    }

    private String normalizeExtension(String raw) {
        String extension = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return extension.startsWith(".") ? extension : "." + extension;
    }
}
