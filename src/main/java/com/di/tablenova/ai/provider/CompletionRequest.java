package com.di.tablenova.ai.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionRequest {
    @Singular
    List<PromptMessage> messages;
    String model;
    double temperature;
    int maxTokens;
}
