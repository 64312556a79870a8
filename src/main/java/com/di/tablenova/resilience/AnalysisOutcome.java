package com.di.tablenova.resilience;

import com.di.tablenova.analysis.model.Finding;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Findings of one guarded category analysis. When a fallback produced them,
 * {@code fallbackUsed} is true and {@code fallbackType} names the strategy that ran.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisOutcome {
    @Singular
    List<Finding> findings;
    boolean fallbackUsed;
    String fallbackType;
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static AnalysisOutcome success(List<Finding> findings) {
        return AnalysisOutcome.builder().findings(findings).build();
    }
}
