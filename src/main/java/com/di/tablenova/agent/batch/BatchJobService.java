package com.di.tablenova.agent.batch;

import com.di.tablenova.agent.analyzer.CategoryAnalyzer;
import com.di.tablenova.agent.analyzer.CostTracker;
import com.di.tablenova.agent.analyzer.TableAnalysis;
import com.di.tablenova.agent.job.CancellationToken;
import com.di.tablenova.agent.job.JobKind;
import com.di.tablenova.agent.job.JobRegistry;
import com.di.tablenova.agent.job.JobRunner;
import com.di.tablenova.agent.job.JobStatus;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.TableDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Background batch analysis of caller-supplied tables. Tables of the same container are passed to
 * each other as related tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchJobService {

    private final BatchAnalysisOrchestrator batchOrchestrator;
    private final CategoryAnalyzer analyzer;
    private final JobRegistry registry;
    private final JobRunner jobRunner;

    public JobStatus start(List<TableDescriptor> tables,
                           List<AnalysisCategory> categories,
                           int batchSize,
                           int maxConcurrency,
                           String fallbackStrategy) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("At least one table is required");
        }
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("At least one analysis category is required");
        }
        if (batchSize < 1 || maxConcurrency < 1) {
            throw new IllegalArgumentException("batchSize and maxConcurrency must be at least 1");
        }
        List<TableDescriptor> snapshot = List.copyOf(tables);
        List<AnalysisCategory> requested = List.copyOf(AnalysisCategory.distinct(categories));
        JobStatus status = jobRunner.submit(JobKind.BATCH_ANALYSIS, snapshot.size(), (jobId, cancellation) ->
                run(jobId, snapshot, requested, batchSize, maxConcurrency, fallbackStrategy, cancellation));
        log.info("[BATCH] Job {} accepted: {} tables x {} categories", status.getJobId(), snapshot.size(), requested.size());
        return status;
    }

    BatchJobResult run(String jobId,
                       List<TableDescriptor> tables,
                       List<AnalysisCategory> categories,
                       int batchSize,
                       int maxConcurrency,
                       String fallbackStrategy,
                       CancellationToken cancellation) {
        long start = System.currentTimeMillis();
        CostTracker jobCost = new CostTracker();
        Map<String, List<TableDescriptor>> byContainer = tables.stream()
                .collect(Collectors.groupingBy(TableDescriptor::getContainerId));
        registry.updateProgress(jobId, "analyze", 0, tables.size());

        BatchAnalysisResult<TableAnalysis> batch = batchOrchestrator.analyzeBatch(tables, batchSize, maxConcurrency,
                table -> analyzer.analyzeTable(table, categories, related(table, byContainer), fallbackStrategy, jobCost),
                cancellation,
                (done, total) -> registry.updateProgress(jobId, "analyze", done, total));

        return BatchJobResult.builder()
                .results(batch.getResults())
                .failures(batch.getFailures())
                .tablesRequested(tables.size())
                .costSummary(jobCost.summary())
                .durationSeconds((System.currentTimeMillis() - start) / 1000.0)
                .cancelled(batch.isCancelled())
                .build();
    }

    public JobStatus status(String jobId) {
        return registry.get(jobId, JobKind.BATCH_ANALYSIS);
    }

    /** @throws com.di.tablenova.exception.JobNotCompletedException unless the job completed */
    public BatchJobResult results(String jobId) {
        return (BatchJobResult) registry.completedResult(jobId, JobKind.BATCH_ANALYSIS);
    }

    private static List<TableDescriptor> related(TableDescriptor table, Map<String, List<TableDescriptor>> byContainer) {
        return byContainer.getOrDefault(table.getContainerId(), List.of()).stream()
                .filter(other -> !other.getTableId().equals(table.getTableId()))
                .collect(Collectors.toList());
    }
}
