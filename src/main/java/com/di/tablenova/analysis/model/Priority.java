package com.di.tablenova.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency of a finding. Unrecognised provider values fall back to {@link #MEDIUM}.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromValue(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return HIGH;
            case "low":
                return LOW;
            default:
                return MEDIUM;
        }
    }
}
