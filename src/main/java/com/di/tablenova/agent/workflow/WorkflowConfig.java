package com.di.tablenova.agent.workflow;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.config.AnalysisProperties;
import com.di.tablenova.platform.PlatformProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Settings of one workflow run. Start from {@link #defaults} and override per request.
 * An empty {@code containerIds} list means every container the platform lists.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowConfig {

    @Singular
    List<String> containerIds;
    @Singular
    List<AnalysisCategory> categories;
    int batchSize;
    int maxConcurrency;
    boolean autoUpdateMetadata;
    double confidenceThreshold;
    String fallbackStrategy;
    /** Where metadata records are written; null means the analysed table's own container. */
    String metadataContainerId;
    String metadataTableId;

    public static WorkflowConfig defaults(AnalysisProperties analysis, PlatformProperties platform) {
        AnalysisProperties.WorkflowConfig workflow = analysis.getWorkflow();
        return WorkflowConfig.builder()
                .categories(AnalysisCategory.all())
                .batchSize(analysis.getBatch().getSize())
                .maxConcurrency(analysis.getBatch().getMaxConcurrency())
                .autoUpdateMetadata(workflow.isAutoUpdateMetadata())
                .confidenceThreshold(workflow.getConfidenceThreshold())
                .fallbackStrategy(workflow.getFallbackStrategy())
                .metadataContainerId(platform.getMetadataContainerId())
                .metadataTableId(platform.getMetadataTableId())
                .build();
    }
}
