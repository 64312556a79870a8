package com.di.tablenova.agent.analyzer;

import com.di.tablenova.analysis.model.AnalysisCategory;

/**
 * Thread-safe accumulator of provider call cost. One instance lives for the process; jobs
 * create their own to report the cost of a single run.
 */
public class CostTracker {

    private double totalCost;
    private long analysisCount;

    public synchronized void record(double cost) {
        totalCost += cost;
        analysisCount++;
    }

    public synchronized CostSummary summary() {
        double perTableDivisor = Math.max((double) analysisCount / AnalysisCategory.values().length, 1.0);
        return CostSummary.builder()
                .totalCost(round4(totalCost))
                .analysisCount(analysisCount)
                .averageCostPerAnalysis(round4(totalCost / Math.max(analysisCount, 1)))
                .estimatedCostPerTable(round4(totalCost / perTableDivisor))
                .build();
    }

    public synchronized double getTotalCost() {
        return totalCost;
    }

    public synchronized long getAnalysisCount() {
        return analysisCount;
    }

    static double round4(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}
