package com.di.tablenova.agent.batch;

import com.di.tablenova.agent.analyzer.CostSummary;
import com.di.tablenova.agent.analyzer.TableAnalysis;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Payload of a finished batch-analysis job. */
@Value
@Builder
public class BatchJobResult {
    Map<String, TableAnalysis> results;
    List<TableFailure> failures;
    int tablesRequested;
    CostSummary costSummary;
    double durationSeconds;
    boolean cancelled;
}
