package com.di.tablenova.analysis.model;

import java.util.Locale;

/**
 * Implementation effort levels a finding may claim.
 * <p>{@link Finding#getEffort()} keeps the provider's raw text so that out-of-set values
 * (e.g. "unknown") can be penalised by the quality gate instead of being silently coerced.
 */
public enum Effort {
    LOW,
    MEDIUM,
    HIGH;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static boolean isKnown(String raw) {
        if (raw == null) {
            return false;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (Effort e : values()) {
            if (e.getValue().equals(v)) {
                return true;
            }
        }
        return false;
    }

    public static boolean is(String raw, Effort expected) {
        return raw != null && expected.getValue().equals(raw.trim().toLowerCase(Locale.ROOT));
    }
}
