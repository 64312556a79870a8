package com.di.tablenova.api.dto;

import com.di.tablenova.agent.analyzer.CostSummary;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class TableAnalysisResponse {
    String tableId;
    String tableName;
    Map<AnalysisCategory, List<Finding>> analysisResults;
    /** Categories answered by a fallback strategy instead of the provider. */
    List<AnalysisCategory> fallbackCategories;
    CostSummary costSummary;
    double analysisDurationSeconds;
    Instant timestamp;
}
