package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.FileKind;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cheap check that upload bytes resemble the kind their extension claims, run before any parser sees them.
 * Binary kinds are matched on magic bytes; text is rejected when its head looks like raw binary.
 */
@Component
public class SignatureValidator {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final List<byte[]> ZIP_SIGNATURES = List.of(
            new byte[]{'P', 'K', 0x03, 0x04},
            new byte[]{'P', 'K', 0x05, 0x06},
            new byte[]{'P', 'K', 0x07, 0x08}
    );
    static final int TEXT_SAMPLE_SIZE = 1024;
    static final double MAX_BINARY_RATIO = 0.1;

    /**
     * @param contents upload body
     * @param kind     kind resolved from the filename
     * @throws ExtractionException with {@link ExtractionFailure#SIGNATURE_MISMATCH} when the bytes disagree with the kind
     */
    public void validate(byte[] contents, FileKind kind) {
        switch (kind) {
            case TEXT -> validateText(contents);
            case PDF -> requirePrefix(contents, List.of(PDF_SIGNATURE), kind);
            case DOCX -> requirePrefix(contents, ZIP_SIGNATURES, kind);
        }
    }

    private void validateText(byte[] contents) {
        int sampleSize = Math.min(contents.length, TEXT_SAMPLE_SIZE);
        if (sampleSize == 0) {
            return;
        }
        int nonText = 0;
        for (int i = 0; i < sampleSize; i++) {
            int b = contents[i] & 0xFF;
            if (b < 0x20 && b != '\t' && b != '\n' && b != '\r') {
                nonText++;
            }
        }
        if ((double) nonText / sampleSize > MAX_BINARY_RATIO) {
            throw new ExtractionException(ExtractionFailure.SIGNATURE_MISMATCH, "File appears to be binary.");
        }
    }

    private void requirePrefix(byte[] contents, List<byte[]> signatures, FileKind kind) {
        for (byte[] signature : signatures) {
            if (startsWith(contents, signature)) {
                return;
            }
        }
        throw new ExtractionException(ExtractionFailure.SIGNATURE_MISMATCH,
                "File content does not match " + kind.wireValue() + " format.");
    }

    private boolean startsWith(byte[] contents, byte[] prefix) {
        if (contents.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (contents[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
