package com.example.echocheck.interfaces.api.dto;

/**
 * Request body of the text classification endpoint.
 *
 * @param text article or statement to classify
 */
public record ClassifyTextRequest(String text) {
}
