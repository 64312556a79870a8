package com.di.tablenova.api.dto;

import com.di.tablenova.analysis.model.AnalysisCategory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Inbound body for the complete workflow and its cost estimate. Every field is optional and
 * overrides the configured default.
 */
@Data
@Builder
@Jacksonized
public class WorkflowStartRequest {

    /** Containers to analyse; empty means all containers the platform lists. */
    private List<String> targetContainerIds;

    private List<AnalysisCategory> categories;

    @Min(value = 1, message = "batchSize must be at least 1")
    @Max(value = 50, message = "batchSize must not exceed 50")
    private Integer batchSize;

    @Min(value = 1, message = "maxConcurrency must be at least 1")
    @Max(value = 20, message = "maxConcurrency must not exceed 20")
    private Integer maxConcurrency;

    private Boolean autoUpdateMetadata;

    @DecimalMin(value = "0.0", message = "confidenceThreshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "confidenceThreshold must be between 0 and 1")
    private Double confidenceThreshold;

    private String fallbackStrategy;

    private String metadataContainerId;

    private String metadataTableId;

    /** Only read by the cost estimate. */
    @Min(value = 1, message = "expectedTableCount must be at least 1")
    private Integer expectedTableCount;
}
