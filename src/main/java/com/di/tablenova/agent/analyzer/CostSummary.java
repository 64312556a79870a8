package com.di.tablenova.agent.analyzer;

import lombok.Builder;
import lombok.Value;

/** Money spent on provider calls so far, rounded to 4 decimals. */
@Value
@Builder
public class CostSummary {
    double totalCost;
    long analysisCount;
    double averageCostPerAnalysis;
    double estimatedCostPerTable;
}
