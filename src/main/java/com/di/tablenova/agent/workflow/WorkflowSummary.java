package com.di.tablenova.agent.workflow;

import com.di.tablenova.agent.analyzer.CostSummary;
import com.di.tablenova.agent.batch.TableFailure;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Result of a workflow run; a failed run carries whatever was collected before the failure. */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowSummary {
    String workflowId;
    String status;
    String error;
    double durationSeconds;
    int tablesDiscovered;
    int tablesAnalyzed;
    int tablesFailed;
    CostSummary costSummary;
    ProcessedResults results;
    MetadataUpdateResult metadataUpdates;
    List<TableFailure> failedTables;
    Instant startedAt;
    Instant completedAt;
}
