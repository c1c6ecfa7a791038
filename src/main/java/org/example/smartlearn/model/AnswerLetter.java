package org.example.smartlearn.model;

import java.util.Locale;

/**
 * One of the four option letters a learner can pick. A missing choice is modelled as {@code null}.
 */
public enum AnswerLetter {
    A,
    B,
    C,
    D;

    /**
     * Parses a learner supplied choice such as {@code "b"}, {@code "B"} or {@code "B. Newton"}.
     * Blank input means "unanswered" and yields {@code null}.
     *
     * @throws IllegalArgumentException when the first character is not one of A-D
     */
    public static AnswerLetter parse(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String first = trimmed.substring(0, 1).toUpperCase(Locale.ROOT);
        if (trimmed.length() > 1 && Character.isLetterOrDigit(trimmed.charAt(1))) {
            throw new IllegalArgumentException("Unsupported answer: " + raw);
        }
        for (AnswerLetter letter : values()) {
            if (letter.name().equals(first)) {
                return letter;
            }
        }
        throw new IllegalArgumentException("Unsupported answer: " + raw);
    }

    public boolean matches(String canonical) {
        return canonical != null && name().equalsIgnoreCase(canonical.trim());
    }
}
