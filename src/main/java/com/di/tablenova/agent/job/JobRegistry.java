package com.di.tablenova.agent.job;

import com.di.tablenova.exception.JobNotCompletedException;
import com.di.tablenova.exception.JobNotFoundException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory store of job snapshots. Every change goes through {@link ConcurrentHashMap#compute},
 * so concurrent updates of one job are serialised and a terminal state is never overwritten.
 * State is lost on restart.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobRegistry() {
        this(Clock.systemUTC());
    }

    public JobRegistry(Clock clock) {
        this.clock = clock;
    }

    public JobStatus create(JobKind kind, int totalUnits) {
        String prefix = kind == JobKind.WORKFLOW ? "wf-" : "batch-";
        String jobId = prefix + UUID.randomUUID().toString().substring(0, 8);
        Instant now = clock.instant();
        JobStatus status = JobStatus.builder()
                .jobId(jobId)
                .kind(kind)
                .state(JobState.PENDING)
                .progress(JobProgress.initial(totalUnits))
                .createdAt(now)
                .updatedAt(now)
                .build();
        tokens.put(jobId, new CancellationToken());
        jobs.put(jobId, status);
        log.info("[JOB] Created {} job {}", kind.getValue(), jobId);
        return status;
    }

    public Optional<JobStatus> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /** @throws JobNotFoundException if the id is unknown */
    public JobStatus get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** @throws JobNotFoundException if the id is unknown or belongs to another kind of job */
    public JobStatus get(String jobId, JobKind kind) {
        return find(jobId).filter(j -> j.getKind() == kind).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Result payload of a completed job.
     *
     * @throws JobNotCompletedException if the job has not reached {@code completed}
     */
    public Object completedResult(String jobId, JobKind kind) {
        JobStatus status = get(jobId, kind);
        if (status.getState() != JobState.COMPLETED) {
            throw new JobNotCompletedException(jobId, status.getState());
        }
        return status.getResult();
    }

    public CancellationToken token(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            throw new JobNotFoundException(jobId);
        }
        return token;
    }

    /**
     * Moves the job to {@code target} and applies {@code changes}, unless the current state does
     * not allow that transition.
     *
     * @return true if the transition happened
     */
    public boolean transition(String jobId, JobState target, UnaryOperator<JobStatus.JobStatusBuilder> changes) {
        AtomicBoolean applied = new AtomicBoolean();
        JobStatus updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (!current.getState().canTransitionTo(target)) {
                return current;
            }
            applied.set(true);
            return changes.apply(current.toBuilder().state(target).updatedAt(clock.instant())).build();
        });
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        if (applied.get()) {
            log.info("[JOB] {} -> {}", jobId, target.getValue());
        } else {
            log.info("[JOB] {} stays {} (requested {})", jobId, updated.getState().getValue(), target.getValue());
        }
        return applied.get();
    }

    /** Updates progress of a non-terminal job; ignored once the job is terminal. */
    public void updateProgress(String jobId, String phase, int completed, int total) {
        jobs.computeIfPresent(jobId, (id, current) -> current.getState().isTerminal()
                ? current
                : current.toBuilder()
                        .progress(new JobProgress(phase, completed, total))
                        .updatedAt(clock.instant())
                        .build());
    }

    /**
     * Requests cancellation. Pending and running jobs become {@code cancelled} and their token is
     * tripped; terminal jobs are left unchanged.
     */
    public CancelOutcome cancel(String jobId) {
        JobStatus before = get(jobId);
        boolean cancelled = transition(jobId, JobState.CANCELLED, b -> b);
        JobStatus after = get(jobId);
        if (cancelled) {
            token(jobId).cancel();
            return new CancelOutcome(jobId, true, after.getState(),
                    before.getKind() == JobKind.WORKFLOW ? "Workflow cancellation requested" : "Job cancellation requested");
        }
        String noun = before.getKind() == JobKind.WORKFLOW ? "Workflow" : "Job";
        return new CancelOutcome(jobId, false, after.getState(),
                noun + " is " + after.getState().getValue() + " and cannot be cancelled");
    }

    /** Pending and running jobs, oldest first. */
    public List<JobStatus> active() {
        return jobs.values().stream()
                .filter(j -> !j.getState().isTerminal())
                .sorted(Comparator.comparing(JobStatus::getCreatedAt))
                .collect(Collectors.toList());
    }

    /** Every job of the kind, oldest first. */
    public List<JobStatus> all(JobKind kind) {
        return jobs.values().stream()
                .filter(j -> j.getKind() == kind)
                .sorted(Comparator.comparing(JobStatus::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<JobStatus> active(JobKind kind) {
        return active().stream().filter(j -> j.getKind() == kind).collect(Collectors.toList());
    }

    /** Drops a job that was never started. */
    void remove(String jobId) {
        jobs.remove(jobId);
        tokens.remove(jobId);
    }

    @Value
    public static class CancelOutcome {
        String jobId;
        boolean cancelled;
        JobState state;
        String message;
    }
}
