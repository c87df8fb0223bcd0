package com.example.echocheck.application.service;

import com.example.echocheck.application.exception.ClassificationFailedException;
import com.example.echocheck.application.port.StanceClassifier;
import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.domain.model.ExtractionResult;
import com.example.echocheck.domain.model.FileClassificationResult;
import com.example.echocheck.domain.model.StancePrediction;
import com.example.echocheck.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Application-layer service behind both classification endpoints: typed text and uploaded documents.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final DocumentExtractionService documentExtractionService;
    private final TextSanitizer textSanitizer;
    private final StanceClassifier stanceClassifier;
    private final ExtractionLimits limits;

    public ClassificationService(DocumentExtractionService documentExtractionService,
                                 TextSanitizer textSanitizer,
                                 StanceClassifier stanceClassifier,
                                 ExtractionLimits limits) {
        this.documentExtractionService = documentExtractionService;
        this.textSanitizer = textSanitizer;
        this.stanceClassifier = stanceClassifier;
        this.limits = limits;
    }

    /**
     * Classifies text submitted directly. Unlike uploads, overlong text is rejected rather than cut.
     *
     * @param rawText text from the request body
     * @return classifier prediction
     * @throws ExtractionException           with {@link ExtractionFailure#TEXT_TOO_SHORT} or {@link ExtractionFailure#TEXT_TOO_LONG}
     * @throws ClassificationFailedException when the classifier call fails
     */
    public StancePrediction classifyText(String rawText) {
        String text = textSanitizer.sanitize(rawText);
        int length = Characters.count(text);
        if (length < limits.minTextLength()) {
            throw new ExtractionException(ExtractionFailure.TEXT_TOO_SHORT,
                    "Text is too short (minimum " + limits.minTextLength() + " characters)");
        }
        if (length > limits.maxTextLength()) {
            throw new ExtractionException(ExtractionFailure.TEXT_TOO_LONG,
                    "Text is too long (maximum " + limits.maxTextLength() + " characters)");
        }
        return predict(text);
    }

    /**
     * Extracts the text of an upload and classifies it.
     *
     * @param file uploaded document
     * @return prediction plus the extraction it was computed from
     */
    public FileClassificationResult classifyFile(MultipartFile file) {
        ExtractionResult extraction = documentExtractionService.extractText(file);
        return new FileClassificationResult(predict(extraction.text()), extraction);
    }

    private StancePrediction predict(String text) {
        try {
            StancePrediction prediction = stanceClassifier.predict(text);
            log.debug("Classified {} characters as {} ({})", Characters.count(text), prediction.stance(), prediction.confidence());
            return prediction;
        } catch (InfrastructureException | IllegalArgumentException ex) {
            log.error("Stance classification failed", ex);
            throw new ClassificationFailedException(ex);
        }
    }
}
