package com.di.tablenova.agent.job;

import com.di.tablenova.config.AsyncConfig;
import com.di.tablenova.metrics.AnalysisMetrics;
import com.di.tablenova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts job bodies on the job executor and drives their state:
 * {@code pending -> running -> completed | failed}. A job cancelled before it starts never runs;
 * a job cancelled while running keeps {@code cancelled} even if its body later returns.
 */
@Slf4j
@Component
public class JobRunner {

    /** The work of one job; receives the job id and its cancellation token. */
    @FunctionalInterface
    public interface JobBody {
        Object run(String jobId, CancellationToken cancellation);
    }

    private final JobRegistry registry;
    private final Executor executor;
    private final AnalysisMetrics metrics;

    public JobRunner(JobRegistry registry,
                     @Qualifier(AsyncConfig.JOB_EXECUTOR) Executor executor,
                     AnalysisMetrics metrics) {
        this.registry = registry;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Registers a pending job and schedules it; returns immediately.
     *
     * @throws IllegalStateException if the executor refuses the job (the job is discarded)
     */
    public JobStatus submit(JobKind kind, int totalUnits, JobBody body) {
        JobStatus created = registry.create(kind, totalUnits);
        String jobId = created.getJobId();
        try {
            executor.execute(() -> MdcPropagation.runWithMdcContext(Map.of("jobId", jobId), () -> run(jobId, kind, body)));
        } catch (RejectedExecutionException e) {
            registry.remove(jobId);
            throw new IllegalStateException("Job capacity exhausted, try again later", e);
        }
        return created;
    }

    void run(String jobId, JobKind kind, JobBody body) {
        if (!registry.transition(jobId, JobState.RUNNING, b -> b)) {
            log.info("[JOB] {} was cancelled before it started", jobId);
            return;
        }
        long start = System.currentTimeMillis();
        try {
            Object result = body.run(jobId, registry.token(jobId));
            boolean completed = registry.transition(jobId, JobState.COMPLETED, b -> b.result(result));
            if (!completed) {
                log.info("[JOB] {} finished after cancellation; result discarded", jobId);
            }
            metrics.recordJobFinished(kind.getValue(), registry.get(jobId).getState().getValue());
            log.info("[JOB] {} finished in {} ms", jobId, System.currentTimeMillis() - start);
        } catch (JobExecutionException e) {
            log.error("[JOB] {} failed: {}", jobId, e.getMessage(), e);
            registry.transition(jobId, JobState.FAILED, b -> b.error(e.getMessage()).result(e.getPartialResult()));
            metrics.recordJobFinished(kind.getValue(), registry.get(jobId).getState().getValue());
        } catch (RuntimeException e) {
            log.error("[JOB] {} failed: {}", jobId, e.getMessage(), e);
            registry.transition(jobId, JobState.FAILED, b -> b.error(e.getClass().getSimpleName() + ": " + e.getMessage()));
            metrics.recordJobFinished(kind.getValue(), registry.get(jobId).getState().getValue());
        }
    }
}
