package com.example.echocheck.domain.model;

import java.util.Locale;

/**
 * Labels produced by the stance classifier.
 */
public enum Stance {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * @return lowercase label used on the wire
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a classifier label, ignoring case and surrounding whitespace.
     *
     * @param label raw label returned by the model
     * @return matching stance
     * @throws IllegalArgumentException when the label is unknown
     */
    public static Stance fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Stance label is missing.");
        }
        return Stance.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
