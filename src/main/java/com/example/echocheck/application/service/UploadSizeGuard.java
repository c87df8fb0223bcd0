package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.infrastructure.exception.UploadReadException;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Loads an upload body into memory once and enforces the configured size bounds.
 */
@Component
public class UploadSizeGuard {

    private final ExtractionLimits limits;

    public UploadSizeGuard(ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Reads the whole upload.
     *
     * @param file multipart upload
     * @return the body bytes, never empty and never above the limit
     * @throws ExtractionException  with {@link ExtractionFailure#EMPTY_FILE} or {@link ExtractionFailure#TOO_LARGE}
     * @throws UploadReadException when the container cannot deliver the body
     */
    public byte[] readAndBound(MultipartFile file) {
        // The declared size lets us refuse oversized bodies before copying them.
        checkLength(file.getSize());
        byte[] contents;
        try {
            contents = file.getBytes();
        } catch (IOException e) {
            throw new UploadReadException("Unable to read the uploaded file.", e);
        }
        checkLength(contents.length);
        return contents;
    }

    private void checkLength(long length) {
        if (length == 0) {
            throw new ExtractionException(ExtractionFailure.EMPTY_FILE);
        }
        if (length > limits.maxUploadBytes()) {
            throw new ExtractionException(ExtractionFailure.TOO_LARGE,
                    "File too large. Maximum size: " + limits.maxUploadMegabytes() + "MB");
        }
    }
}
