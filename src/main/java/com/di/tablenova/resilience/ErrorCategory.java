package com.di.tablenova.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Taxonomy used to classify failures of provider calls, platform calls and API requests.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Classification looks at the lower-cased message plus the exception's simple type name.
 * Rules are evaluated in {@link #MATCHERS} order; first match wins.
 */
public enum ErrorCategory {

    NETWORK("network", "Network error", "Connection or transport failure talking to a remote service", true),
    API_LIMIT("api_limit", "API limit", "Rate limit or quota exhausted at the provider", true),
    AUTHENTICATION("authentication", "Authentication error", "Credentials rejected or access forbidden", false),
    PARSING("parsing", "Parsing error", "Response could not be decoded or parsed", true),
    VALIDATION("validation", "Validation error", "Input or response failed validation", false),
    TIMEOUT("timeout", "Timeout error", "Operation exceeded its time limit", true),
    RESOURCE("resource", "Resource error", "Memory or other system resource exhausted", true),
    UNKNOWN("unknown", "Unknown error", "Unclassified error", true);

    private final String value;
    private final String name;
    private final String description;
    private final boolean retryable;

    ErrorCategory(String value, String name, String description, boolean retryable) {
        this.value = value;
        this.name = name;
        this.description = description;
        this.retryable = retryable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Authentication and validation failures are never retried. */
    public boolean isRetryable() {
        return retryable;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<String>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(text -> containsAny(text, "timeout"), TIMEOUT);
        MATCHERS.put(text -> containsAny(text, "rate", "quota", "limit"), API_LIMIT);
        MATCHERS.put(text -> containsAny(text, "auth", "unauthorized", "forbidden"), AUTHENTICATION);
        MATCHERS.put(text -> containsAny(text, "json", "parse", "decode"), PARSING);
        MATCHERS.put(text -> containsAny(text, "network", "connection", "http"), NETWORK);
        MATCHERS.put(text -> containsAny(text, "memory", "resource"), RESOURCE);
        MATCHERS.put(text -> containsAny(text, "validation"), VALIDATION);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        String message = exception.getMessage() != null ? exception.getMessage() : "";
        return categorize(message, exception.getClass().getSimpleName());
    }

    public static ErrorCategory categorize(String message, String errorType) {
        String text = ((message != null ? message : "") + " " + (errorType != null ? errorType : ""))
                .toLowerCase(Locale.ROOT);
        for (Map.Entry<Predicate<String>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(text)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) {
                return true;
            }
        }
        return false;
    }
}
