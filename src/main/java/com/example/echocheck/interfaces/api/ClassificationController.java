package com.example.echocheck.interfaces.api;

import com.example.echocheck.application.exception.UnauthorizedException;
import com.example.echocheck.application.port.AccessTokenVerifier;
import com.example.echocheck.application.service.ClassificationService;
import com.example.echocheck.domain.model.AuthenticatedUser;
import com.example.echocheck.interfaces.api.dto.ClassifyResponse;
import com.example.echocheck.interfaces.api.dto.ClassifyTextRequest;
import com.example.echocheck.interfaces.api.dto.FileClassifyResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Interfaces-layer REST controller for stance classification of typed text and uploaded documents.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ClassificationController {

    private static final Logger log = LoggerFactory.getLogger(ClassificationController.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final ClassificationService classificationService;
    private final AccessTokenVerifier accessTokenVerifier;

    /**
     * Creates the controller with the required application services.
     *
     * @param classificationService use cases for text and file classification
     * @param accessTokenVerifier   token service guarding the upload endpoint
     */
    public ClassificationController(ClassificationService classificationService,
                                    AccessTokenVerifier accessTokenVerifier) {
        this.classificationService = classificationService;
        this.accessTokenVerifier = accessTokenVerifier;
    }

    /**
     * Classifies text sent in the request body. No authentication required.
     *
     * @param request body holding the text (10 to 50,000 characters after sanitization)
     * @return predicted stance, confidence and per-label probabilities
     */
    @PostMapping(value = "/classify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ClassifyResponse> classifyText(@RequestBody ClassifyTextRequest request) {
        return ResponseEntity.ok(ClassifyResponse.from(classificationService.classifyText(request.text())));
    }

    /**
     * Extracts the text of an uploaded .txt, .pdf or .docx file and classifies it.
     * The bearer token is verified before the upload is looked at.
     *
     * @param authorization {@code Authorization} header
     * @param file          uploaded document
     * @return prediction together with the sanitized filename, kind and extracted length
     */
    @PostMapping(value = "/classify/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FileClassifyResponse> classifyFile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam("file") MultipartFile file) {
        AuthenticatedUser user = accessTokenVerifier.verify(bearerToken(authorization));
        log.debug("File classification requested by user {}", user.id());
        return ResponseEntity.ok(FileClassifyResponse.from(classificationService.classifyFile(file)));
    }

    private String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException("Not authenticated");
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
