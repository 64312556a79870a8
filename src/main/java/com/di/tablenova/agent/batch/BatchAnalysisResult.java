package com.di.tablenova.agent.batch;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Successful results keyed by table id, plus one failure record per table whose task threw.
 * {@code cancelled} is set when cancellation stopped scheduling before every batch ran.
 */
@Value
@Builder
public class BatchAnalysisResult<T> {
    Map<String, T> results;
    List<TableFailure> failures;
    int batchesRun;
    boolean cancelled;
}
