package com.di.tablenova.ai.provider;

import lombok.Value;

@Value
public class TokenUsage {

    public static final TokenUsage NONE = new TokenUsage(0, 0);

    long inputTokens;
    long outputTokens;

    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
