package com.di.tablenova.quality;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationVerdict {
    VALID,
    WARNING,
    INVALID;

    static final double VALID_THRESHOLD = 0.8;
    static final double WARNING_THRESHOLD = 0.5;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Score of 0.8 or more is valid, 0.5 or more is a warning, anything lower is invalid. */
    public static ValidationVerdict forScore(double score) {
        if (score >= VALID_THRESHOLD) {
            return VALID;
        }
        if (score >= WARNING_THRESHOLD) {
            return WARNING;
        }
        return INVALID;
    }
}
