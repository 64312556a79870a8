package com.di.tablenova.agent.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advisory cancellation flag checked between batches and workflow phases.
 * In-flight provider calls are not interrupted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
