package com.di.tablenova.api.dto;

import com.di.tablenova.analysis.model.AnalysisCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Inbound body for a background batch analysis; unset knobs use the configured defaults. */
@Data
@Builder
@Jacksonized
public class BatchAnalysisRequest {

    @NotEmpty(message = "tables must not be empty")
    private List<@Valid TableAnalysisRequest> tables;

    @Min(value = 1, message = "batchSize must be at least 1")
    @Max(value = 50, message = "batchSize must not exceed 50")
    private Integer batchSize;

    @Min(value = 1, message = "maxConcurrency must be at least 1")
    @Max(value = 20, message = "maxConcurrency must not exceed 20")
    private Integer maxConcurrency;

    /** Applied to every table; null or empty means every category. */
    private List<AnalysisCategory> categories;

    /** simplified, cached or partial. */
    private String fallbackStrategy;
}
