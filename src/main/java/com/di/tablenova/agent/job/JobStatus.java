package com.di.tablenova.agent.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a background job. The registry replaces snapshots atomically;
 * the result payload is served separately from the status.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatus {
    String jobId;
    JobKind kind;
    JobState state;
    JobProgress progress;
    @JsonIgnore
    Object result;
    String error;
    Instant createdAt;
    Instant updatedAt;

    public boolean isResultAvailable() {
        return result != null;
    }
}
