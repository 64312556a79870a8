package com.di.tablenova.agent.workflow;

import com.di.tablenova.agent.analyzer.CategoryAnalyzer;
import com.di.tablenova.agent.analyzer.CostEstimate;
import com.di.tablenova.agent.analyzer.CostTracker;
import com.di.tablenova.agent.analyzer.TableAnalysis;
import com.di.tablenova.agent.batch.BatchAnalysisOrchestrator;
import com.di.tablenova.agent.batch.BatchAnalysisResult;
import com.di.tablenova.agent.job.CancellationToken;
import com.di.tablenova.agent.job.JobExecutionException;
import com.di.tablenova.agent.job.JobKind;
import com.di.tablenova.agent.job.JobRegistry;
import com.di.tablenova.agent.job.JobRunner;
import com.di.tablenova.agent.job.JobStatus;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.config.AnalysisProperties;
import com.di.tablenova.platform.ContainerInfo;
import com.di.tablenova.platform.PlatformException;
import com.di.tablenova.platform.TabularDataPlatform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * End-to-end workflow: discover tables on the platform, analyse them in batches, run the quality
 * gate, write summaries back to the metadata table, and report.
 *
 * <p>Each phase is published as job progress. Cancellation is checked between phases and between
 * batches; a cancelled run returns what it has and the job stays {@code cancelled}.
 */
@Slf4j
@Service
public class WorkflowOrchestrator {

    static final String PHASE_DISCOVER = "discover";
    static final String PHASE_ANALYZE = "analyze";
    static final String PHASE_PROCESS = "process";
    static final String PHASE_UPDATE = "update";
    static final String PHASE_FINALIZE = "finalize";

    private final TabularDataPlatform platform;
    private final CategoryAnalyzer analyzer;
    private final BatchAnalysisOrchestrator batchOrchestrator;
    private final ResultProcessor resultProcessor;
    private final MetadataUpdater metadataUpdater;
    private final JobRegistry registry;
    private final JobRunner jobRunner;
    private final AnalysisProperties.WorkflowConfig workflowDefaults;

    public WorkflowOrchestrator(TabularDataPlatform platform,
                                CategoryAnalyzer analyzer,
                                BatchAnalysisOrchestrator batchOrchestrator,
                                ResultProcessor resultProcessor,
                                MetadataUpdater metadataUpdater,
                                JobRegistry registry,
                                JobRunner jobRunner,
                                AnalysisProperties analysisProperties) {
        this.platform = platform;
        this.analyzer = analyzer;
        this.batchOrchestrator = batchOrchestrator;
        this.resultProcessor = resultProcessor;
        this.metadataUpdater = metadataUpdater;
        this.registry = registry;
        this.jobRunner = jobRunner;
        this.workflowDefaults = analysisProperties.getWorkflow();
    }

    /** Registers a workflow job and runs it in the background. */
    public JobStatus start(WorkflowConfig config) {
        if (config.getCategories().isEmpty()) {
            throw new IllegalArgumentException("At least one analysis category is required");
        }
        return jobRunner.submit(JobKind.WORKFLOW, 0, (jobId, cancellation) -> run(jobId, config, cancellation));
    }

    /**
     * Runs all phases on the calling thread.
     *
     * @throws JobExecutionException carrying the partial summary when a phase fails
     */
    public WorkflowSummary run(String jobId, WorkflowConfig config, CancellationToken cancellation) {
        Instant startedAt = Instant.now();
        CostTracker jobCost = new CostTracker();
        WorkflowSummary.WorkflowSummaryBuilder summary = WorkflowSummary.builder()
                .workflowId(jobId)
                .startedAt(startedAt)
                .failedTables(List.of());

        try {
            registry.updateProgress(jobId, PHASE_DISCOVER, 0, 0);
            log.info("[WORKFLOW] Starting table discovery");
            List<TableDescriptor> tables = discover(config.getContainerIds());
            summary.tablesDiscovered(tables.size());
            log.info("[WORKFLOW] Discovered {} tables for analysis", tables.size());
            if (cancellation.isCancelled()) {
                return finish(summary, startedAt, jobCost, "cancelled");
            }

            registry.updateProgress(jobId, PHASE_ANALYZE, 0, tables.size());
            Map<String, List<TableDescriptor>> byContainer = tables.stream()
                    .collect(Collectors.groupingBy(TableDescriptor::getContainerId, LinkedHashMap::new, Collectors.toList()));
            BatchAnalysisResult<TableAnalysis> batch = batchOrchestrator.analyzeBatch(
                    tables,
                    config.getBatchSize(),
                    config.getMaxConcurrency(),
                    table -> analyzer.analyzeTable(table, config.getCategories(),
                            relatedTables(table, byContainer), config.getFallbackStrategy(), jobCost),
                    cancellation,
                    (done, total) -> registry.updateProgress(jobId, PHASE_ANALYZE, done, total));
            summary.tablesAnalyzed(batch.getResults().size())
                    .tablesFailed(batch.getFailures().size())
                    .failedTables(batch.getFailures());
            log.info("[WORKFLOW] Completed analysis for {} tables, {} failed", batch.getResults().size(), batch.getFailures().size());
            if (cancellation.isCancelled()) {
                return finish(summary, startedAt, jobCost, "cancelled");
            }

            registry.updateProgress(jobId, PHASE_PROCESS, 0, batch.getResults().size());
            Map<String, TableDescriptor> tablesById = new LinkedHashMap<>();
            tables.forEach(t -> tablesById.put(t.getTableId(), t));
            ProcessedResults processed = resultProcessor.process(batch.getResults(), tablesById, config.getConfidenceThreshold());
            summary.results(processed);
            if (cancellation.isCancelled()) {
                return finish(summary, startedAt, jobCost, "cancelled");
            }

            if (config.isAutoUpdateMetadata()) {
                registry.updateProgress(jobId, PHASE_UPDATE, 0, processed.getTableSummaries().size());
                log.info("[WORKFLOW] Updating metadata with results");
                summary.metadataUpdates(metadataUpdater.update(processed.getTableSummaries(), config));
            } else {
                summary.metadataUpdates(MetadataUpdateResult.skippedResult());
            }

            registry.updateProgress(jobId, PHASE_FINALIZE, batch.getResults().size(), tables.size());
            WorkflowSummary done = finish(summary, startedAt, jobCost, "completed");
            log.info("[WORKFLOW] Workflow {} completed in {}s: {} analysed, {} failed", jobId,
                    done.getDurationSeconds(), done.getTablesAnalyzed(), done.getTablesFailed());
            return done;
        } catch (RuntimeException e) {
            log.error("[WORKFLOW] Workflow {} failed: {}", jobId, e.getMessage(), e);
            WorkflowSummary partial = finish(summary.error(e.getMessage()), startedAt, jobCost, "failed");
            throw new JobExecutionException(e.getClass().getSimpleName() + ": " + e.getMessage(), e, partial);
        }
    }

    /**
     * Lists the requested (or all) containers and reads their schemas. A container whose schema
     * cannot be read is skipped; failing to list containers is fatal.
     */
    List<TableDescriptor> discover(List<String> containerIds) {
        List<String> ids = containerIds;
        if (ids == null || ids.isEmpty()) {
            ids = platform.listContainers().stream().map(ContainerInfo::getId).collect(Collectors.toList());
        }
        List<TableDescriptor> tables = new ArrayList<>();
        for (String containerId : ids) {
            try {
                tables.addAll(platform.getSchema(containerId));
            } catch (PlatformException e) {
                log.warn("[WORKFLOW] Failed to get schema for container {}: {}", containerId, e.getMessage());
            }
        }
        return tables;
    }

    public WorkflowCostEstimate estimateCost(Integer expectedTableCount, List<AnalysisCategory> categories) {
        int tableCount = expectedTableCount != null ? expectedTableCount : workflowDefaults.getExpectedTableCount();
        CostEstimate analysis = analyzer.estimateBatchCost(tableCount, categories);
        double overhead = workflowDefaults.getDiscoveryOverheadMinutes()
                + workflowDefaults.getProcessingOverheadMinutes()
                + workflowDefaults.getUpdateOverheadMinutes();
        return WorkflowCostEstimate.builder()
                .analysis(analysis)
                .workflowOverhead(WorkflowCostEstimate.Overhead.builder()
                        .tableDiscoveryTimeMinutes(workflowDefaults.getDiscoveryOverheadMinutes())
                        .resultProcessingTimeMinutes(workflowDefaults.getProcessingOverheadMinutes())
                        .metadataUpdatesTimeMinutes(workflowDefaults.getUpdateOverheadMinutes())
                        .totalOverheadMinutes(overhead)
                        .build())
                .totalEstimatedTimeMinutes(analysis.getEstimatedTimeMinutes() + overhead)
                .build();
    }

    private static List<TableDescriptor> relatedTables(TableDescriptor table, Map<String, List<TableDescriptor>> byContainer) {
        return byContainer.getOrDefault(table.getContainerId(), List.of()).stream()
                .filter(other -> !other.getTableId().equals(table.getTableId()))
                .collect(Collectors.toList());
    }

    private static WorkflowSummary finish(WorkflowSummary.WorkflowSummaryBuilder summary, Instant startedAt,
                                          CostTracker jobCost, String status) {
        Instant now = Instant.now();
        return summary
                .status(status)
                .costSummary(jobCost.summary())
                .durationSeconds(Duration.between(startedAt, now).toMillis() / 1000.0)
                .completedAt(now)
                .build();
    }
}
