package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.domain.model.FileKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps a sanitized filename to the {@link FileKind} that will handle it.
 * The extension is authoritative; the client's content type is attacker-controlled and only logged.
 */
@Component
public class FileKindResolver {

    private static final Logger log = LoggerFactory.getLogger(FileKindResolver.class);

    private final ExtractionLimits limits;

    public FileKindResolver(ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Resolves the kind of an upload from its extension.
     *
     * @param safeFilename output of {@link FilenameSanitizer#sanitize(String)}
     * @param contentType  declared content type, advisory only, may be {@code null}
     * @return kind owning the extension
     * @throws ExtractionException with {@link ExtractionFailure#UNSUPPORTED_TYPE} when the extension is not allowed
     */
    public FileKind resolve(String safeFilename, String contentType) {
        String extension = extensionOf(safeFilename);
        log.debug("Resolving file kind for extension '{}' (declared content type: {})", extension, contentType);

        if (!limits.allowedExtensions().contains(extension)) {
            throw unsupported();
        }
        return FileKind.fromExtension(extension).orElseThrow(this::unsupported);
    }

    private String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private ExtractionException unsupported() {
        String allowed = limits.allowedExtensions().stream().sorted().collect(Collectors.joining(", "));
        return new ExtractionException(ExtractionFailure.UNSUPPORTED_TYPE,
                "Unsupported file type. Allowed types: " + allowed);
    }
}
