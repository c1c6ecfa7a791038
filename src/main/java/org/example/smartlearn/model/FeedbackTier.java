package org.example.smartlearn.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative feedback bucket for one submission.
 */
public enum FeedbackTier {
    PERFECT("perfect"),
    NEAR_PERFECT("near_perfect"),
    GOOD("good"),
    ENCOURAGE("encourage");

    private final String code;

    FeedbackTier(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static FeedbackTier of(int correct, int total) {
        if (correct == total) {
            return PERFECT;
        }
        if (total > 1 && correct >= total - 1) {
            return NEAR_PERFECT;
        }
        if (correct >= total / 2.0) {
            return GOOD;
        }
        return ENCOURAGE;
    }
}
