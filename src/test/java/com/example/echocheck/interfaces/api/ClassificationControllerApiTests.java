package com.example.echocheck.interfaces.api;

import com.example.echocheck.application.exception.ClassificationFailedException;
import com.example.echocheck.application.exception.UnauthorizedException;
import com.example.echocheck.application.port.AccessTokenVerifier;
import com.example.echocheck.application.port.StanceClassifier;
import com.example.echocheck.application.service.ClassificationService;
import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.AuthenticatedUser;
import com.example.echocheck.domain.model.ExtractionResult;
import com.example.echocheck.domain.model.FileClassificationResult;
import com.example.echocheck.domain.model.FileKind;
import com.example.echocheck.domain.model.Stance;
import com.example.echocheck.domain.model.StancePrediction;
import com.example.echocheck.infrastructure.exception.RemoteServiceException;
import com.example.echocheck.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = {ClassificationController.class, HealthController.class})
@Import(GlobalExceptionHandler.class)
class ClassificationControllerApiTests {

    private static final StancePrediction LEFT_LEANING = StancePrediction.fromProbabilities(
            Map.of(Stance.LEFT, 0.7, Stance.CENTER, 0.2, Stance.RIGHT, 0.1));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClassificationService classificationService;

    @MockBean
    private AccessTokenVerifier accessTokenVerifier;

    @MockBean
    private StanceClassifier stanceClassifier;

    private static MockMultipartFile essay() {
        return new MockMultipartFile("file", "essay.txt", "text/plain",
                "A fairly long essay about public policy.".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void classifyTextReturnsPrediction() throws Exception {
        BDDMockito.given(classificationService.classifyText("Healthcare should be universal."))
                .willReturn(LEFT_LEANING);

        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Healthcare should be universal.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction").value("left"))
                .andExpect(jsonPath("$.confidence").value(0.7))
                .andExpect(jsonPath("$.probabilities.center").value(0.2))
                .andExpect(jsonPath("$.probabilities.right").value(0.1));
    }

    @Test
    void classifyTextMapsShortTextToBadRequest() throws Exception {
        BDDMockito.given(classificationService.classifyText(anyString()))
                .willThrow(new ExtractionException(ExtractionFailure.TEXT_TOO_SHORT));

        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("TEXT_TOO_SHORT"))
                .andExpect(jsonPath("$.details.statusClass").value("BAD_INPUT"));
    }

    @Test
    void classifyTextRejectsUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void classifyFileRequiresBearerToken() throws Exception {
        mockMvc.perform(multipart("/api/classify/file").file(essay()))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("Not authenticated"));

        verify(classificationService, never()).classifyFile(any(MultipartFile.class));
    }

    @Test
    void classifyFileMapsRejectedTokenToUnauthorized() throws Exception {
        BDDMockito.given(accessTokenVerifier.verify("stale"))
                .willThrow(new UnauthorizedException("Invalid or expired access token"));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer stale"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid or expired access token"));

        verify(classificationService, never()).classifyFile(any(MultipartFile.class));
    }

    @Test
    void classifyFileReturnsPredictionWithExtractionDetails() throws Exception {
        String text = "A fairly long essay about public policy.";
        BDDMockito.given(accessTokenVerifier.verify("good"))
                .willReturn(new AuthenticatedUser("user-1", "reader@example.com"));
        BDDMockito.given(classificationService.classifyFile(any(MultipartFile.class)))
                .willReturn(new FileClassificationResult(LEFT_LEANING,
                        new ExtractionResult(text, FileKind.TEXT, "essay.txt")));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "bearer good"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction").value("left"))
                .andExpect(jsonPath("$.filename").value("essay.txt"))
                .andExpect(jsonPath("$.fileType").value("txt"))
                .andExpect(jsonPath("$.extractedLength").value(text.length()));
    }

    @Test
    void classifyFileMapsOversizedUploadToPayloadTooLarge() throws Exception {
        BDDMockito.given(accessTokenVerifier.verify("good"))
                .willReturn(new AuthenticatedUser("user-1", "reader@example.com"));
        BDDMockito.given(classificationService.classifyFile(any(MultipartFile.class)))
                .willThrow(new ExtractionException(ExtractionFailure.TOO_LARGE, "File too large. Maximum size: 10MB"));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer good"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("TOO_LARGE"))
                .andExpect(jsonPath("$.message").value("File too large. Maximum size: 10MB"))
                .andExpect(jsonPath("$.details.statusClass").value("PAYLOAD_TOO_LARGE"));
    }

    @Test
    void classifyFileMapsContainerUploadLimitToPayloadTooLarge() throws Exception {
        BDDMockito.given(accessTokenVerifier.verify("good"))
                .willReturn(new AuthenticatedUser("user-1", "reader@example.com"));
        BDDMockito.given(classificationService.classifyFile(any(MultipartFile.class)))
                .willThrow(new MaxUploadSizeExceededException(12L * 1024 * 1024));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer good"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("TOO_LARGE"))
                .andExpect(jsonPath("$.message").value(ExtractionFailure.TOO_LARGE.defaultMessage()));
    }

    @Test
    void classifyFileMapsZipBombToBadRequest() throws Exception {
        BDDMockito.given(accessTokenVerifier.verify("good"))
                .willReturn(new AuthenticatedUser("user-1", "reader@example.com"));
        BDDMockito.given(classificationService.classifyFile(any(MultipartFile.class)))
                .willThrow(new ExtractionException(ExtractionFailure.ZIP_BOMB));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer good"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ZIP_BOMB"));
    }

    @Test
    void classifyFileMapsClassifierFailureToServerError() throws Exception {
        BDDMockito.given(accessTokenVerifier.verify("good"))
                .willReturn(new AuthenticatedUser("user-1", "reader@example.com"));
        BDDMockito.given(classificationService.classifyFile(any(MultipartFile.class)))
                .willThrow(new ClassificationFailedException(new RemoteServiceException("timeout", null)));

        mockMvc.perform(multipart("/api/classify/file").file(essay())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer good"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("CLASSIFICATION_FAILED"))
                .andExpect(jsonPath("$.message").value("Classification failed: timeout"));
    }

    @Test
    void classifyFileRejectsRequestsWithoutFilePart() throws Exception {
        mockMvc.perform(multipart("/api/classify/file")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer good"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void healthReportsClassifierModel() throws Exception {
        BDDMockito.given(stanceClassifier.modelName()).willReturn("stance-model");

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.classifierModel").value("stance-model"));
    }
}
