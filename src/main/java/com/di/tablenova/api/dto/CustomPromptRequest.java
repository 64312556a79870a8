package com.di.tablenova.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/** Free-form prompt; unset model settings fall back to {@code tablenova.ai.chat.*}. */
@Data
@Builder
@Jacksonized
public class CustomPromptRequest {

    @NotBlank(message = "customPrompt must not be blank")
    private String customPrompt;

    private String model;

    @DecimalMin(value = "0.0", message = "temperature must be between 0 and 2")
    @DecimalMax(value = "2.0", message = "temperature must be between 0 and 2")
    private Double temperature;

    @Min(value = 1, message = "maxTokens must be at least 1")
    @Max(value = 8192, message = "maxTokens must not exceed 8192")
    private Integer maxTokens;
}
