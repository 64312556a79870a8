package com.di.tablenova.api;

import com.di.tablenova.agent.job.JobKind;
import com.di.tablenova.agent.job.JobRegistry;
import com.di.tablenova.agent.job.JobState;
import com.di.tablenova.agent.job.JobStatus;
import com.di.tablenova.agent.workflow.WorkflowConfig;
import com.di.tablenova.agent.workflow.WorkflowCostEstimate;
import com.di.tablenova.agent.workflow.WorkflowOrchestrator;
import com.di.tablenova.agent.workflow.WorkflowSummary;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.api.dto.ActiveWorkflowsResponse;
import com.di.tablenova.api.dto.CancelResponse;
import com.di.tablenova.api.dto.JobAcceptedResponse;
import com.di.tablenova.api.dto.WorkflowStartRequest;
import com.di.tablenova.config.AnalysisProperties;
import com.di.tablenova.platform.PlatformProperties;
import com.di.tablenova.resilience.FaultToleranceService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for the complete discover → analyse → process → update workflow.
 *
 * <pre>
 * POST   /workflow/start-complete-analysis → start a workflow job (202)
 * GET    /workflow/status/{id}             → job status
 * GET    /workflow/results/{id}            → workflow summary (400 until completed)
 * DELETE /workflow/{id}                    → best-effort cancel
 * POST   /workflow/estimate-workflow-cost  → cost and time estimate with overhead
 * GET    /workflow/active-workflows        → workflows grouped by state
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/workflow")
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final JobRegistry registry;
    private final FaultToleranceService faultTolerance;
    private final AnalysisProperties analysisProperties;
    private final PlatformProperties platformProperties;

    public WorkflowController(WorkflowOrchestrator orchestrator,
                              JobRegistry registry,
                              FaultToleranceService faultTolerance,
                              AnalysisProperties analysisProperties,
                              PlatformProperties platformProperties) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.faultTolerance = faultTolerance;
        this.analysisProperties = analysisProperties;
        this.platformProperties = platformProperties;
    }

    @PostMapping(path = "/start-complete-analysis", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobAcceptedResponse> start(@Valid @RequestBody(required = false) WorkflowStartRequest request) {
        WorkflowConfig config = toConfig(request);
        faultTolerance.requireStrategy(config.getFallbackStrategy());
        log.info("[WORKFLOW-CTRL] POST /start-complete-analysis containers={} categories={}",
                config.getContainerIds().isEmpty() ? "all" : config.getContainerIds(), config.getCategories().size());
        JobStatus status = orchestrator.start(config);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.builder()
                .workflowId(status.getJobId())
                .status("started")
                .message("Complete analysis workflow started")
                .build());
    }

    @GetMapping(path = "/status/{workflowId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobStatus> status(@PathVariable String workflowId) {
        return ResponseEntity.ok(registry.get(workflowId, JobKind.WORKFLOW));
    }

    @GetMapping(path = "/results/{workflowId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WorkflowSummary> results(@PathVariable String workflowId) {
        return ResponseEntity.ok((WorkflowSummary) registry.completedResult(workflowId, JobKind.WORKFLOW));
    }

    @DeleteMapping(path = "/{workflowId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CancelResponse> cancel(@PathVariable String workflowId) {
        registry.get(workflowId, JobKind.WORKFLOW);
        JobRegistry.CancelOutcome outcome = registry.cancel(workflowId);
        log.info("[WORKFLOW-CTRL] DELETE /{} cancelled={} state={}", workflowId, outcome.isCancelled(), outcome.getState().getValue());
        return ResponseEntity.ok(new CancelResponse(workflowId, outcome.isCancelled(),
                outcome.getState().getValue(), outcome.getMessage()));
    }

    @PostMapping(path = "/estimate-workflow-cost", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WorkflowCostEstimate> estimate(@Valid @RequestBody(required = false) WorkflowStartRequest request) {
        Integer expected = request != null ? request.getExpectedTableCount() : null;
        List<AnalysisCategory> categories = request != null ? request.getCategories() : null;
        return ResponseEntity.ok(orchestrator.estimateCost(expected, categories));
    }

    @GetMapping(path = "/active-workflows", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ActiveWorkflowsResponse> activeWorkflows() {
        List<JobStatus> all = registry.all(JobKind.WORKFLOW);
        return ResponseEntity.ok(ActiveWorkflowsResponse.builder()
                .activeWorkflows(all.stream().filter(j -> !j.getState().isTerminal()).collect(Collectors.toList()))
                .completedWorkflows(all.stream().filter(j -> j.getState() == JobState.COMPLETED).collect(Collectors.toList()))
                .failedWorkflows(all.stream()
                        .filter(j -> j.getState() == JobState.FAILED || j.getState() == JobState.CANCELLED)
                        .collect(Collectors.toList()))
                .totalWorkflows(all.size())
                .build());
    }

    private WorkflowConfig toConfig(WorkflowStartRequest request) {
        WorkflowConfig defaults = WorkflowConfig.defaults(analysisProperties, platformProperties);
        if (request == null) {
            return defaults;
        }
        WorkflowConfig.WorkflowConfigBuilder builder = defaults.toBuilder();
        if (request.getTargetContainerIds() != null) {
            builder.clearContainerIds().containerIds(request.getTargetContainerIds());
        }
        if (request.getCategories() != null && !request.getCategories().isEmpty()) {
            builder.clearCategories().categories(request.getCategories());
        }
        if (request.getBatchSize() != null) {
            builder.batchSize(request.getBatchSize());
        }
        if (request.getMaxConcurrency() != null) {
            builder.maxConcurrency(request.getMaxConcurrency());
        }
        if (request.getAutoUpdateMetadata() != null) {
            builder.autoUpdateMetadata(request.getAutoUpdateMetadata());
        }
        if (request.getConfidenceThreshold() != null) {
            builder.confidenceThreshold(request.getConfidenceThreshold());
        }
        if (request.getFallbackStrategy() != null) {
            builder.fallbackStrategy(request.getFallbackStrategy());
        }
        if (request.getMetadataContainerId() != null) {
            builder.metadataContainerId(request.getMetadataContainerId());
        }
        if (request.getMetadataTableId() != null) {
            builder.metadataTableId(request.getMetadataTableId());
        }
        return builder.build();
    }
}
