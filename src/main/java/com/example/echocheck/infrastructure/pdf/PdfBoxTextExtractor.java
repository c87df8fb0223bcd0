package com.example.echocheck.infrastructure.pdf;

import com.example.echocheck.domain.exception.ExtractionException;
import com.example.echocheck.domain.exception.ExtractionFailure;
import com.example.echocheck.domain.model.ExtractionLimits;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Infrastructure service that extracts page text from PDF uploads with PDFBox,
 * bounding the page count and the amount of text collected.
 */
@Service
public class PdfBoxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    /**
     * Extraction stops once this many characters were collected, independently of the final text cap.
     */
    static final int MAX_COLLECTED_CHARACTERS = 100_000;
    private static final String PAGE_SEPARATOR = "\n\n";

    private final ExtractionLimits limits;

    public PdfBoxTextExtractor(ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Extracts the text of every page, in document order.
     *
     * @param contents signature-checked PDF bytes
     * @return page texts joined by blank lines, not yet sanitized
     * @throws ExtractionException tagged {@link ExtractionFailure#TOO_MANY_PAGES},
     *                             {@link ExtractionFailure#PROTECTED_DOCUMENT},
     *                             {@link ExtractionFailure#NO_EXTRACTABLE_TEXT} or
     *                             {@link ExtractionFailure#MALFORMED_DOCUMENT}
     */
    public String extract(byte[] contents) {
        List<String> pageTexts;
        try (PDDocument document = Loader.loadPDF(contents)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount > limits.maxPdfPages()) {
                throw new ExtractionException(ExtractionFailure.TOO_MANY_PAGES,
                        "PDF has too many pages (max " + limits.maxPdfPages() + ")");
            }
            pageTexts = extractPages(document, pageCount);
        } catch (InvalidPasswordException e) {
            throw new ExtractionException(ExtractionFailure.PROTECTED_DOCUMENT,
                    "PDF is password-protected. Please provide an unencrypted file.", e);
        } catch (ExtractionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw translateParseFailure(e);
        }

        if (pageTexts.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.NO_EXTRACTABLE_TEXT,
                    "Could not extract text from PDF. The file may be scanned/image-based or empty.");
        }
        return String.join(PAGE_SEPARATOR, pageTexts);
    }

    /**
     * Runs a single-page {@link PDFTextStripper} per page so collection can stop early.
     *
     * @param document  loaded PDF document
     * @param pageCount number of pages, already checked against the limit
     * @return non-empty page texts; whitespace-only pages are kept and left to the length check
     * @throws IOException when PDFBox cannot read the page content
     */
    private List<String> extractPages(PDDocument document, int pageCount) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);

        List<String> pageTexts = new ArrayList<>();
        int collected = 0;
        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String pageText = stripper.getText(document);
            if (pageText == null || pageText.isEmpty()) {
                continue;
            }
            pageTexts.add(pageText);
            collected += pageText.length();
            if (collected > MAX_COLLECTED_CHARACTERS) {
                log.debug("Stopped PDF extraction after page {} of {} ({} characters)", page, pageCount, collected);
                break;
            }
        }
        return pageTexts;
    }

    private ExtractionException translateParseFailure(Exception e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("password") || message.contains("encrypt")) {
            return new ExtractionException(ExtractionFailure.PROTECTED_DOCUMENT,
                    "PDF is password-protected. Please provide an unencrypted file.", e);
        }
        log.debug("PDFBox could not parse the upload", e);
        return new ExtractionException(ExtractionFailure.MALFORMED_DOCUMENT,
                "Failed to read PDF file. Please ensure it's a valid PDF.", e);
    }
}
