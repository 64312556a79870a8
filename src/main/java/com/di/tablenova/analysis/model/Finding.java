package com.di.tablenova.analysis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One improvement recommendation produced by the provider for a (table, category) pair.
 * <p>Confidence is clamped to [0,1] by {@link com.di.tablenova.analysis.FindingParser}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Finding {
    String tableId;
    String tableName;
    AnalysisCategory category;
    Priority priority;
    String issueType;
    String description;
    String recommendation;
    String impact;
    /** Raw effort text; see {@link Effort#isKnown(String)}. */
    String effort;
    String estimatedImprovement;
    @Singular
    List<String> implementationSteps;
    double confidenceScore;

    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    public String recommendationOrEmpty() {
        return recommendation == null ? "" : recommendation;
    }
}
