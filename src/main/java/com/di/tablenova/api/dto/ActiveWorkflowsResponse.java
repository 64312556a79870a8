package com.di.tablenova.api.dto;

import com.di.tablenova.agent.job.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Workflows grouped by state: pending/running, completed, and failed or cancelled. */
@Value
@Builder
public class ActiveWorkflowsResponse {
    List<JobStatus> activeWorkflows;
    List<JobStatus> completedWorkflows;
    List<JobStatus> failedWorkflows;
    int totalWorkflows;
}
