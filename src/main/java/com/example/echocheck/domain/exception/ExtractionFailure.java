package com.example.echocheck.domain.exception;

/**
 * Every reason the ingestion pipeline can reject an upload or a submitted text.
 * All of them stem from the input itself, so none is worth retrying unchanged.
 */
public enum ExtractionFailure {
    INVALID_FILENAME("Invalid filename."),
    UNSUPPORTED_TYPE("Unsupported file type."),
    EMPTY_FILE("File is empty."),
    TOO_LARGE("File too large.", StatusClass.PAYLOAD_TOO_LARGE),
    SIGNATURE_MISMATCH("File content does not match its declared type."),
    UNDECODABLE_TEXT("Could not decode text file. Please ensure it uses a standard encoding (UTF-8 recommended)."),
    TOO_MANY_PAGES("PDF has too many pages."),
    PROTECTED_DOCUMENT("Document is password-protected. Please provide an unencrypted file."),
    NO_EXTRACTABLE_TEXT("Could not extract text from the document. The file may be scanned, image-based or empty."),
    MALFORMED_DOCUMENT("Failed to read the document. Please ensure it is a valid file."),
    ZIP_BOMB("File content is too large when decompressed."),
    TEXT_TOO_SHORT("Extracted text is too short."),
    TEXT_TOO_LONG("Text is too long.");

    /**
     * HTTP-agnostic classification of a failure, translated to a status code at the API boundary.
     */
    public enum StatusClass {
        BAD_INPUT,
        PAYLOAD_TOO_LARGE
    }

    private final String defaultMessage;
    private final StatusClass statusClass;

    ExtractionFailure(String defaultMessage) {
        this(defaultMessage, StatusClass.BAD_INPUT);
    }

    ExtractionFailure(String defaultMessage, StatusClass statusClass) {
        this.defaultMessage = defaultMessage;
        this.statusClass = statusClass;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public StatusClass statusClass() {
        return statusClass;
    }
}
