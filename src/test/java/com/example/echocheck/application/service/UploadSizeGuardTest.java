package com.example.echocheck.application.service;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import com.example.echocheck.infrastructure.exception.UploadReadException;
import com.example.echocheck.support.TestDocuments;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the upload size guard.
 */
class UploadSizeGuardTest {

    private final UploadSizeGuard guard = new UploadSizeGuard(
            TestDocuments.uploadLimits(ExtractionLimits.defaults().allowedExtensions(), 16));

    @Test
    void readAndBoundReturnsBodyWithinLimit() {
        byte[] body = "sixteen bytes!!!".getBytes(StandardCharsets.US_ASCII);

        assertThat(guard.readAndBound(new MockMultipartFile("file", "a.txt", "text/plain", body))).isEqualTo(body);
    }

    @Test
    void readAndBoundRejectsEmptyUpload() {
        ExtractionException ex = assertThrows(ExtractionException.class,
                () -> guard.readAndBound(new MockMultipartFile("file", "a.txt", "text/plain", new byte[0])));

        assertThat(ex.getFailure()).isEqualTo(ExtractionFailure.EMPTY_FILE);
    }

    @Test
    void readAndBoundRejectsOversizedUploadAsPayloadTooLarge() {
        ExtractionException ex = assertThrows(ExtractionException.class,
                () -> guard.readAndBound(new MockMultipartFile("file", "a.txt", "text/plain", new byte[17])));

        assertThat(ex.getFailure()).isEqualTo(ExtractionFailure.TOO_LARGE);
        assertThat(ex.getFailure().statusClass()).isEqualTo(ExtractionFailure.StatusClass.PAYLOAD_TOO_LARGE);
    }

    @Test
    void readAndBoundRefusesDeclaredOversizeWithoutReadingBody() throws IOException {
        MultipartFile file = mock(MultipartFile.class);
        given(file.getSize()).willReturn(1_000_000L);

        assertThrows(ExtractionException.class, () -> guard.readAndBound(file));
        verify(file, never()).getBytes();
    }

    @Test
    void readAndBoundWrapsReadFailures() throws IOException {
        MultipartFile file = mock(MultipartFile.class);
        given(file.getSize()).willReturn(8L);
        given(file.getBytes()).willThrow(new IOException("connection reset"));

        assertThrows(UploadReadException.class, () -> guard.readAndBound(file));
    }
}
