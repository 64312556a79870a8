package com.di.tablenova.quality;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of validating every finding of a batch: scores, counts, rejected findings and
 * the accepted findings grouped by table and category.
 */
@Value
@Builder
public class BatchValidationSummary {

    double overallQualityScore;
    Map<String, Double> tableScores;
    Map<String, Double> categoryScores;
    Statistics statistics;
    List<QualityIssue> qualityIssues;
    List<String> recommendations;

    /** Accepted findings: table id, then category. Not serialized with the summary. */
    @JsonIgnore
    Map<String, Map<AnalysisCategory, List<ValidatedFinding>>> acceptedFindings;

    @Value
    @Builder
    public static class Statistics {
        int totalAnalyses;
        int validAnalyses;
        int warningAnalyses;
        int invalidAnalyses;
    }

    /** A rejected finding with the worst check message and a short description preview. */
    @Value
    @Builder
    public static class QualityIssue {
        String tableId;
        AnalysisCategory category;
        String issue;
        String analysisPreview;
    }
}
