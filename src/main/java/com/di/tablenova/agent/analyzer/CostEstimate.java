package com.di.tablenova.agent.analyzer;

import com.di.tablenova.analysis.model.AnalysisCategory;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Heuristic cost and duration of analysing a number of tables; no provider call is made. */
@Value
@Builder
public class CostEstimate {

    static final double MINUTES_PER_ANALYSIS = 0.5;

    double estimatedTotalCost;
    double costPerTable;
    int categoriesCount;
    int tableCount;
    double estimatedTimeMinutes;

    /**
     * Repeated categories are counted once.
     *
     * @throws IllegalArgumentException if {@code tableCount < 1} or no category is given
     */
    public static CostEstimate of(int tableCount, List<AnalysisCategory> categories) {
        if (tableCount < 1) {
            throw new IllegalArgumentException("tableCount must be at least 1");
        }
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("At least one analysis category is required");
        }
        List<AnalysisCategory> distinct = AnalysisCategory.distinct(categories);
        double perTable = distinct.stream().mapToDouble(AnalysisCategory::getEstimatedCallCost).sum();
        double total = perTable * tableCount;
        return CostEstimate.builder()
                .estimatedTotalCost(CostTracker.round4(total))
                .costPerTable(CostTracker.round4(perTable))
                .categoriesCount(distinct.size())
                .tableCount(tableCount)
                .estimatedTimeMinutes(tableCount * distinct.size() * MINUTES_PER_ANALYSIS)
                .build();
    }
}
