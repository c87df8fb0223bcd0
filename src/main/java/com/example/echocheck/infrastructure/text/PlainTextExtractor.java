package com.example.echocheck.infrastructure.text;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes plain text uploads, honouring byte-order marks and otherwise falling back through
 * a fixed list of encodings.
 */
@Service
public class PlainTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PlainTextExtractor.class);
    private static final List<Charset> FALLBACK_CHARSETS = List.of(
            StandardCharsets.UTF_8,
            StandardCharsets.ISO_8859_1,
            Charset.forName("windows-1252")
    );

    /**
     * Decodes the upload.
     *
     * @param contents signature-checked upload bytes
     * @return decoded text, not yet sanitized
     * @throws ExtractionException with {@link ExtractionFailure#UNDECODABLE_TEXT} when no encoding yields usable text
     */
    public String extract(byte[] contents) {
        if (hasUtf8Bom(contents)) {
            return decodeStrict(ByteBuffer.wrap(contents, 3, contents.length - 3), StandardCharsets.UTF_8);
        }
        if (hasUtf16Bom(contents)) {
            // The UTF-16 decoder reads the byte order from the BOM and drops it.
            return decodeStrict(ByteBuffer.wrap(contents), StandardCharsets.UTF_16);
        }

        for (Charset charset : FALLBACK_CHARSETS) {
            try {
                String text = newDecoder(charset).decode(ByteBuffer.wrap(contents)).toString();
                if (!text.isBlank()) {
                    log.debug("Decoded text upload as {}", charset.name());
                    return text;
                }
            } catch (CharacterCodingException e) {
                log.debug("Text upload is not valid {}: {}", charset.name(), e.getMessage());
            }
        }
        throw new ExtractionException(ExtractionFailure.UNDECODABLE_TEXT);
    }

    private String decodeStrict(ByteBuffer buffer, Charset charset) {
        try {
            return newDecoder(charset).decode(buffer).toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionException(ExtractionFailure.UNDECODABLE_TEXT,
                    ExtractionFailure.UNDECODABLE_TEXT.defaultMessage(), e);
        }
    }

    private CharsetDecoder newDecoder(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private boolean hasUtf8Bom(byte[] contents) {
        return contents.length >= 3
                && (contents[0] & 0xFF) == 0xEF
                && (contents[1] & 0xFF) == 0xBB
                && (contents[2] & 0xFF) == 0xBF;
    }

    private boolean hasUtf16Bom(byte[] contents) {
        if (contents.length < 2) {
            return false;
        }
        int first = contents[0] & 0xFF;
        int second = contents[1] & 0xFF;
        return (first == 0xFF && second == 0xFE) || (first == 0xFE && second == 0xFF);
    }
}
