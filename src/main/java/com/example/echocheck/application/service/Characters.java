package com.example.echocheck.application.service;

/**
 * Length and truncation by Unicode code point, so limits count what a reader sees as characters
 * and a cut never separates the two halves of a surrogate pair.
 */
final class Characters {

    private Characters() {
    }

    static int count(String value) {
        return value.codePointCount(0, value.length());
    }

    /**
     * @return the first {@code maxCodePoints} characters of {@code value}, or {@code value} itself when shorter
     */
    static String prefix(String value, int maxCodePoints) {
        if (count(value) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }
}
