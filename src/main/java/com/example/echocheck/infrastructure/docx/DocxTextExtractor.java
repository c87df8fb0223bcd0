package com.example.echocheck.infrastructure.docx;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Infrastructure service that extracts paragraph text from Word (.docx) uploads.
 * A .docx file is a ZIP archive of XML parts, so the archive directory is inspected for
 * decompression amplification before POI inflates and parses anything.
 */
@Service
public class DocxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocxTextExtractor.class);
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final ExtractionLimits limits;

    public DocxTextExtractor(ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Checks the archive, then collects the non-blank body paragraphs in document order.
     *
     * @param contents signature-checked .docx bytes
     * @return paragraphs joined by blank lines, not yet sanitized
     * @throws ExtractionException tagged {@link ExtractionFailure#ZIP_BOMB},
     *                             {@link ExtractionFailure#MALFORMED_DOCUMENT},
     *                             {@link ExtractionFailure#PROTECTED_DOCUMENT} or
     *                             {@link ExtractionFailure#NO_EXTRACTABLE_TEXT}
     */
    public String extract(byte[] contents) {
        checkDeclaredSize(contents);

        List<String> paragraphs = readParagraphs(contents);
        if (paragraphs.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.NO_EXTRACTABLE_TEXT,
                    "Could not extract text from document. The file may be empty.");
        }
        return String.join(PARAGRAPH_SEPARATOR, paragraphs);
    }

    /**
     * Sums the uncompressed sizes declared in the central directory. Entries are never inflated here.
     *
     * @param contents archive bytes
     */
    void checkDeclaredSize(byte[] contents) {
        long declared = 0;
        try (ZipFile zipFile = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(contents))
                .get()) {
            for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
                if (entry.getSize() > 0) {
                    declared += entry.getSize();
                }
                if (declared > limits.maxDecompressedBytes() || declared < 0) {
                    log.warn("Rejected .docx archive: declared uncompressed size exceeds {} bytes",
                            limits.maxDecompressedBytes());
                    throw new ExtractionException(ExtractionFailure.ZIP_BOMB);
                }
            }
        } catch (IOException e) {
            throw new ExtractionException(ExtractionFailure.MALFORMED_DOCUMENT, "Invalid DOCX file format.", e);
        }
    }

    private List<String> readParagraphs(byte[] contents) {
        List<String> paragraphs = new ArrayList<>();
        // POI builds its XML parsers with DTD loading and external entities disabled.
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(contents))) {
            int index = 0;
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                if (++index > limits.maxDocxParagraphs()) {
                    log.debug("Stopped .docx extraction at the paragraph limit ({})", limits.maxDocxParagraphs());
                    break;
                }
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    paragraphs.add(text);
                }
            }
        } catch (EncryptedDocumentException e) {
            throw protectedDocument(e);
        } catch (IOException | RuntimeException e) {
            throw translateParseFailure(e);
        }
        return paragraphs;
    }

    private ExtractionException translateParseFailure(Exception e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("encrypt") || message.contains("password")) {
            return protectedDocument(e);
        }
        if (message.contains("zip bomb")) {
            return new ExtractionException(ExtractionFailure.ZIP_BOMB, ExtractionFailure.ZIP_BOMB.defaultMessage(), e);
        }
        log.debug("POI could not parse the upload", e);
        return new ExtractionException(ExtractionFailure.MALFORMED_DOCUMENT,
                "Failed to read Word document. Please ensure it's a valid .docx file.", e);
    }

    private ExtractionException protectedDocument(Exception cause) {
        return new ExtractionException(ExtractionFailure.PROTECTED_DOCUMENT,
                "Document is password-protected. Please provide an unencrypted file.", cause);
    }
}
