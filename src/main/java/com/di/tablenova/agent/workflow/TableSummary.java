package com.di.tablenova.agent.workflow;

import com.di.tablenova.analysis.model.AnalysisCategory;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Per-table digest written to the metadata store. */
@Value
@Builder
public class TableSummary {

    String tableId;
    String tableName;
    String containerId;
    int totalIssues;
    int highPriority;
    int mediumPriority;
    int lowPriority;
    List<AnalysisCategory> categoriesAnalyzed;
    List<TopRecommendation> topRecommendations;

    @Value
    public static class TopRecommendation {
        AnalysisCategory category;
        String recommendation;
        double confidence;
    }
}
