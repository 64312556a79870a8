package com.di.tablenova.agent.workflow;

import com.di.tablenova.agent.analyzer.CostEstimate;
import lombok.Builder;
import lombok.Value;

/** Analysis estimate for an expected table count plus fixed workflow overhead. */
@Value
@Builder
public class WorkflowCostEstimate {

    CostEstimate analysis;
    Overhead workflowOverhead;
    double totalEstimatedTimeMinutes;

    @Value
    @Builder
    public static class Overhead {
        double tableDiscoveryTimeMinutes;
        double resultProcessingTimeMinutes;
        double metadataUpdatesTimeMinutes;
        double totalOverheadMinutes;
    }
}
