package com.di.tablenova.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ErrorRecord {
    Instant timestamp;
    String errorType;
    String message;
    ErrorCategory category;
    ErrorSeverity severity;
    ErrorContext context;

    /** Key used for the error pattern histogram, e.g. {@code timeout_ProviderTimeoutException}. */
    public String patternKey() {
        return category.getValue() + "_" + errorType;
    }
}
