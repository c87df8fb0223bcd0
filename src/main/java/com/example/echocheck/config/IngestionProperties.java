package com.example.echocheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits for the document ingestion pipeline, bound from {@code echocheck.ingestion.*}.
 */
@ConfigurationProperties(prefix = "echocheck.ingestion")
public class IngestionProperties {
    private List<String> allowedExtensions = new ArrayList<>(List.of(".txt", ".pdf", ".docx"));
    private DataSize maxUploadSize = DataSize.ofMegabytes(10);
    private int maxPdfPages = 500;
    private int maxDocxParagraphs = 10_000;
    private DataSize maxDecompressedSize = DataSize.ofMegabytes(50);
    private int minTextLength = 10;
    private int maxTextLength = 50_000;

    public List<String> getAllowedExtensions() { return allowedExtensions; }
    public void setAllowedExtensions(List<String> allowedExtensions) { this.allowedExtensions = allowedExtensions; }
    public DataSize getMaxUploadSize() { return maxUploadSize; }
    public void setMaxUploadSize(DataSize maxUploadSize) { this.maxUploadSize = maxUploadSize; }
    public int getMaxPdfPages() { return maxPdfPages; }
    public void setMaxPdfPages(int maxPdfPages) { this.maxPdfPages = maxPdfPages; }
    public int getMaxDocxParagraphs() { return maxDocxParagraphs; }
    public void setMaxDocxParagraphs(int maxDocxParagraphs) { this.maxDocxParagraphs = maxDocxParagraphs; }
    public DataSize getMaxDecompressedSize() { return maxDecompressedSize; }
    public void setMaxDecompressedSize(DataSize maxDecompressedSize) { this.maxDecompressedSize = maxDecompressedSize; }
    public int getMinTextLength() { return minTextLength; }
    public void setMinTextLength(int minTextLength) { this.minTextLength = minTextLength; }
    public int getMaxTextLength() { return maxTextLength; }
    public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }
}
