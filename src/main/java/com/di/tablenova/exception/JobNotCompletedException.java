package com.di.tablenova.exception;

import com.di.tablenova.agent.job.JobState;

/** Results were requested for a job that has not reached {@code completed}. */
public class JobNotCompletedException extends RuntimeException {

    private final JobState state;

    public JobNotCompletedException(String jobId, JobState state) {
        super("Job " + jobId + " is not completed (state: " + state.getValue() + ")");
        this.state = state;
    }

    public JobState getState() {
        return state;
    }
}
