package com.di.tablenova.ai.provider;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class CompletionResult {
    String text;
    TokenUsage usage;
    /** USD. */
    double cost;
    String model;
    /** Provider finish reason, e.g. {@code STOP} or {@code MAX_TOKENS}; may be null. */
    String finishReason;

    /** True when the provider stopped because the output token limit was reached. */
    public boolean isTruncated() {
        if (finishReason == null) {
            return false;
        }
        String reason = finishReason.toUpperCase(Locale.ROOT);
        return reason.contains("MAX_TOKENS") || reason.equals("LENGTH");
    }
}
