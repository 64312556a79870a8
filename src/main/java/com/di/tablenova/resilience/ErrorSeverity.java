package com.di.tablenova.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Base severity of a category, escalated one level (low to medium, medium to high)
     * when the failure happened on the final attempt.
     */
    public static ErrorSeverity of(ErrorCategory category, boolean finalAttempt) {
        ErrorSeverity base;
        switch (category) {
            case AUTHENTICATION:
            case API_LIMIT:
            case RESOURCE:
                base = HIGH;
                break;
            case PARSING:
            case VALIDATION:
                base = LOW;
                break;
            default:
                base = MEDIUM;
        }
        if (!finalAttempt) {
            return base;
        }
        if (base == LOW) {
            return MEDIUM;
        }
        if (base == MEDIUM) {
            return HIGH;
        }
        return base;
    }
}
