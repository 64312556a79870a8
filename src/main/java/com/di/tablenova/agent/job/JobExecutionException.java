package com.di.tablenova.agent.job;

/**
 * Thrown by a job body that failed but still has a partial result worth keeping.
 */
public class JobExecutionException extends RuntimeException {

    private final transient Object partialResult;

    public JobExecutionException(String message, Throwable cause, Object partialResult) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public Object getPartialResult() {
        return partialResult;
    }
}
