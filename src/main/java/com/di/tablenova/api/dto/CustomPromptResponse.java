package com.di.tablenova.api.dto;

import com.di.tablenova.ai.provider.TokenUsage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CustomPromptResponse {
    String response;
    TokenUsage usage;
    String model;
    /** USD. */
    double cost;
    Instant timestamp;
}
