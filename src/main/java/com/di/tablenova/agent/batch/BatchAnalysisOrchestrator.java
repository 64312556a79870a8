package com.di.tablenova.agent.batch;

import com.di.tablenova.agent.job.CancellationToken;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Runs one task per table in sequential batches with bounded concurrency.
 *
 * <p>A semaphore with {@code maxConcurrency} permits limits in-flight tasks; all tasks of a batch
 * are joined before the next batch is scheduled. A task that throws is recorded as a
 * {@link TableFailure} and never affects its siblings.
 */
@Slf4j
@Service
public class BatchAnalysisOrchestrator {

    /** Receives (tables done, tables total) after every batch. */
    @FunctionalInterface
    public interface ProgressListener {
        void onBatchCompleted(int completed, int total);
    }

    private final Executor executor;

    public BatchAnalysisOrchestrator(@Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> BatchAnalysisResult<T> analyzeBatch(List<TableDescriptor> tables,
                                                   int batchSize,
                                                   int maxConcurrency,
                                                   Function<TableDescriptor, T> task,
                                                   CancellationToken cancellation,
                                                   ProgressListener progress) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Semaphore permits = new Semaphore(maxConcurrency);
        Map<String, T> results = Collections.synchronizedMap(new LinkedHashMap<>());
        List<TableFailure> failures = Collections.synchronizedList(new ArrayList<>());
        int total = tables.size();
        int batches = 0;
        boolean cancelled = false;

        for (int from = 0; from < total; from += batchSize) {
            if (cancellation != null && cancellation.isCancelled()) {
                log.info("[BATCH] Cancellation requested, stopping after {} of {} tables", from, total);
                cancelled = true;
                break;
            }
            List<TableDescriptor> batch = tables.subList(from, Math.min(from + batchSize, total));
            batches++;
            log.info("[BATCH] Batch {} started: {} tables (maxConcurrency={})", batches, batch.size(), maxConcurrency);

            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (TableDescriptor table : batch) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> runWithPermit(permits, table, task), executor)
                        .handle((value, error) -> {
                            if (error != null) {
                                Throwable cause = error instanceof CompletionException && error.getCause() != null
                                        ? error.getCause() : error;
                                log.error("[BATCH] Table {} ({}) failed: {}", table.getTableName(), table.getTableId(),
                                        cause.getMessage(), cause);
                                failures.add(new TableFailure(table.getTableId(), table.getTableName(),
                                        cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                            } else {
                                results.put(table.getTableId(), value);
                            }
                            return null;
                        }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            int done = Math.min(from + batchSize, total);
            if (progress != null) {
                progress.onBatchCompleted(done, total);
            }
            log.info("[BATCH] Batch {} finished: {}/{} tables done, {} failures so far", batches, done, total, failures.size());
        }

        return BatchAnalysisResult.<T>builder()
                .results(new LinkedHashMap<>(results))
                .failures(new ArrayList<>(failures))
                .batchesRun(batches)
                .cancelled(cancelled)
                .build();
    }

    private static <T> T runWithPermit(Semaphore permits, TableDescriptor table, Function<TableDescriptor, T> task) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for an analysis slot for table " + table.getTableId(), e);
        }
        try {
            return task.apply(table);
        } finally {
            permits.release();
        }
    }
}
