package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.domain.model.ExtractionResult;
import com.example.echocheck.domain.model.FileKind;
import com.example.echocheck.infrastructure.docx.DocxTextExtractor;
import com.example.echocheck.infrastructure.exception.UploadReadException;
import com.example.echocheck.infrastructure.pdf.PdfBoxTextExtractor;
import com.example.echocheck.infrastructure.text.PlainTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Application-layer service that turns an untrusted upload into clean, bounded text.
 * Every step runs in a fixed order and the first rejection ends the run; nothing is retried
 * and no fallback extraction is attempted.
 */
@Service
public class DocumentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionService.class);

    private final FilenameSanitizer filenameSanitizer;
    private final FileKindResolver fileKindResolver;
    private final UploadSizeGuard uploadSizeGuard;
    private final SignatureValidator signatureValidator;
    private final PlainTextExtractor plainTextExtractor;
    private final PdfBoxTextExtractor pdfTextExtractor;
    private final DocxTextExtractor docxTextExtractor;
    private final TextSanitizer textSanitizer;
    private final ExtractionLimits limits;

    /**
     * Creates the service with its pipeline stages.
     *
     * @param filenameSanitizer  strips paths and hidden-file tricks from the client filename
     * @param fileKindResolver   maps the extension to a {@link FileKind}
     * @param uploadSizeGuard    reads the body and enforces the size limit
     * @param signatureValidator compares the bytes with the claimed kind
     * @param plainTextExtractor decodes text uploads
     * @param pdfTextExtractor   extracts PDF page text
     * @param docxTextExtractor  extracts Word paragraphs
     * @param textSanitizer      normalizes the extracted text
     * @param limits             text length bounds
     */
    public DocumentExtractionService(FilenameSanitizer filenameSanitizer,
                                     FileKindResolver fileKindResolver,
                                     UploadSizeGuard uploadSizeGuard,
                                     SignatureValidator signatureValidator,
                                     PlainTextExtractor plainTextExtractor,
                                     PdfBoxTextExtractor pdfTextExtractor,
                                     DocxTextExtractor docxTextExtractor,
                                     TextSanitizer textSanitizer,
                                     ExtractionLimits limits) {
        this.filenameSanitizer = filenameSanitizer;
        this.fileKindResolver = fileKindResolver;
        this.uploadSizeGuard = uploadSizeGuard;
        this.signatureValidator = signatureValidator;
        this.plainTextExtractor = plainTextExtractor;
        this.pdfTextExtractor = pdfTextExtractor;
        this.docxTextExtractor = docxTextExtractor;
        this.textSanitizer = textSanitizer;
        this.limits = limits;
    }

    /**
     * Runs the ingestion pipeline on an upload.
     *
     * @param file uploaded document
     * @return sanitized text (cut to the maximum length), resolved kind and safe filename
     * @throws ExtractionException  tagged with the first {@link ExtractionFailure} encountered
     * @throws UploadReadException when the upload body cannot be read
     */
    public ExtractionResult extractText(MultipartFile file) {
        try {
            if (file == null) {
                throw new ExtractionException(ExtractionFailure.EMPTY_FILE, "Please choose a file to upload.");
            }
            String safeFilename = filenameSanitizer.sanitize(file.getOriginalFilename());
            FileKind kind = fileKindResolver.resolve(safeFilename, file.getContentType());
            byte[] contents = uploadSizeGuard.readAndBound(file);
            signatureValidator.validate(contents, kind);

            String rawText = switch (kind) {
                case TEXT -> plainTextExtractor.extract(contents);
                case PDF -> pdfTextExtractor.extract(contents);
                case DOCX -> docxTextExtractor.extract(contents);
            };

            String text = boundLength(textSanitizer.sanitize(rawText));
            log.info("Extracted {} characters from {} upload '{}'", Characters.count(text), kind.wireValue(), safeFilename);
            return new ExtractionResult(text, kind, safeFilename);
        } catch (ExtractionException ex) {
            log.warn("Rejected upload: {} ({})", ex.getFailure(), ex.getMessage());
            throw ex;
        }
    }

    /**
     * Applies the minimum length check and the silent maximum length cut.
     *
     * @param text sanitized text
     * @return text of at most {@code maxTextLength} characters
     */
    private String boundLength(String text) {
        if (Characters.count(text) < limits.minTextLength()) {
            throw new ExtractionException(ExtractionFailure.TEXT_TOO_SHORT,
                    "Extracted text is too short (minimum " + limits.minTextLength() + " characters)");
        }
        return Characters.prefix(text, limits.maxTextLength());
    }
}
